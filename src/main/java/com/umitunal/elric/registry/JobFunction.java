package com.umitunal.elric.registry;

import java.util.List;
import java.util.Map;

/**
 * Handler a job invokes when a worker executes it.
 */
@FunctionalInterface
public interface JobFunction {

    /**
     * Run the job body.
     *
     * @param args positional arguments
     * @param kwargs keyword arguments
     * @return handler result, may be null
     * @throws Exception if execution fails
     */
    Object call(List<Object> args, Map<String, Object> kwargs) throws Exception;
}
