package com.umitunal.elric.storage;

import com.umitunal.elric.core.JobStore;

class MemoryJobStoreTest extends JobStoreContract {

    @Override
    protected JobStore createStore() {
        return new MemoryJobStore();
    }
}
