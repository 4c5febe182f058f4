package com.umitunal.elric.registry;

import com.umitunal.elric.core.CallableResolutionException;
import com.umitunal.elric.core.JobDefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CallableRegistryTest {

    @Test
    @DisplayName("Should resolve registered callables by reference and by instance")
    void testResolve() {
        // Given
        JobFunction send = (args, kwargs) -> "sent";
        CallableRegistry registry = new CallableRegistry()
                .register("mail.send", send, FunctionSignature.of("to"));

        // When
        RegisteredCallable byName = registry.resolve("mail.send");

        // Then
        assertThat(byName.getFunction()).isSameAs(send);
        assertThat(byName.getSignature().getParameters()).containsExactly("to");
        assertThat(registry.lookup(send)).contains(byName);
        assertThat(registry.contains("mail.send")).isTrue();
        assertThat(registry.references()).containsExactly("mail.send");
    }

    @Test
    @DisplayName("Should fail with a distinguishable error for unknown references")
    void testUnknownReference() {
        CallableRegistry registry = new CallableRegistry();

        assertThatThrownBy(() -> registry.resolve("os.system"))
                .isInstanceOf(CallableResolutionException.class)
                .isInstanceOf(JobDefinitionException.class)
                .hasMessageContaining("os.system")
                .extracting("reference").isEqualTo("os.system");
        assertThatThrownBy(() -> registry.resolve(null))
                .isInstanceOf(CallableResolutionException.class);
    }

    @Test
    @DisplayName("Should refuse to register the same reference twice")
    void testDuplicateRegistration() {
        CallableRegistry registry = new CallableRegistry()
                .register("task", (a, k) -> null, FunctionSignature.any());

        assertThatThrownBy(() -> registry.register("task", (a, k) -> null, FunctionSignature.any()))
                .isInstanceOf(IllegalStateException.class);
    }
}
