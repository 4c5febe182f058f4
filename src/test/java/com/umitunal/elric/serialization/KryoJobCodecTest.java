package com.umitunal.elric.serialization;

import com.esotericsoftware.kryo.io.Output;
import com.umitunal.elric.core.JobCodecException;
import com.umitunal.elric.core.Trigger;
import com.umitunal.elric.core.TriggerType;
import com.umitunal.elric.model.JobDescriptor;
import com.umitunal.elric.trigger.CronTrigger;
import com.umitunal.elric.trigger.DateTrigger;
import com.umitunal.elric.trigger.IntervalTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.*;

class KryoJobCodecTest {

    private final KryoJobCodec codec = new KryoJobCodec();

    @Test
    @DisplayName("Should round-trip a job and keep argument types")
    void testArgumentTypes() {
        // Given
        Map<String, Object> kwargs = new HashMap<>();
        kwargs.put("limit", 10_000_000_000L);
        kwargs.put("ratio", 0.25d);
        kwargs.put("missing", null);
        JobDescriptor original = JobDescriptor.builder("job-1", "etl.load")
                .args(Arrays.asList("table", 7, 7L, new ArrayList<>(List.of("x", "y"))))
                .kwargs(kwargs)
                .trigger(new IntervalTrigger(0, 60000))
                .nextRunTime(60000L)
                .build();

        // When
        JobDescriptor decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded).isEqualTo(original);
        assertThat(decoded.getArgs().get(1)).isInstanceOf(Integer.class);
        assertThat(decoded.getArgs().get(2)).isInstanceOf(Long.class);
        assertThat(decoded.getKwargs()).containsEntry("missing", null);
    }

    @Test
    @DisplayName("Should encode every trigger variant and the absence of one")
    void testTriggerVariants() {
        List<JobDescriptor> jobs = List.of(
                JobDescriptor.builder("a", "f").build(),
                JobDescriptor.builder("b", "f").trigger(new DateTrigger(99)).nextRunTime(99L).build(),
                JobDescriptor.builder("c", "f").trigger(new IntervalTrigger(5, 5, 50L)).nextRunTime(5L).build(),
                JobDescriptor.builder("d", "f").trigger(new CronTrigger("*/5 * * * * *", 0)).nextRunTime(0L)
                        .filter("k", "v").build());

        for (JobDescriptor job : jobs) {
            assertThat(codec.decode(codec.encode(job))).isEqualTo(job);
        }
    }

    @Test
    @DisplayName("Should reject truncated input and unknown versions")
    void testMalformedInput() {
        byte[] encoded = codec.encode(JobDescriptor.builder("job", "f").trigger(new DateTrigger(1)).nextRunTime(1L).build());

        assertThatThrownBy(() -> codec.decode(Arrays.copyOf(encoded, encoded.length / 2)))
                .isInstanceOf(JobCodecException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(JobCodecException.class);

        byte[] futureVersion = encoded.clone();
        futureVersion[0] = 9;
        assertThatThrownBy(() -> codec.decode(futureVersion))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("version");
    }

    @Test
    @DisplayName("Should refuse triggers it has no tag for")
    void testForeignTriggerImplementation() {
        Trigger foreign = new Trigger() {
            @Override
            public OptionalLong nextFireTime(OptionalLong previousFireTime, long referenceTime) {
                return OptionalLong.empty();
            }

            @Override
            public TriggerType getType() {
                return TriggerType.DATE;
            }
        };
        JobDescriptor job = JobDescriptor.builder("x", "f").trigger(foreign).nextRunTime(1L).build();

        assertThatThrownBy(() -> codec.encode(job))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("DateTrigger");
    }

    @Test
    @DisplayName("Should reject element counts larger than the remaining input")
    void testOversizedCounts() {
        // Given: a few bytes claiming billions of arguments
        Output argsHeader = new Output(64);
        argsHeader.writeByte(KryoJobCodec.VERSION);
        argsHeader.writeString("id");
        argsHeader.writeString("f");
        argsHeader.writeVarInt(Integer.MAX_VALUE - 8, true);

        Output kwargsHeader = new Output(64);
        kwargsHeader.writeByte(KryoJobCodec.VERSION);
        kwargsHeader.writeString("id");
        kwargsHeader.writeString("f");
        kwargsHeader.writeVarInt(0, true);
        kwargsHeader.writeVarInt(Integer.MAX_VALUE - 8, true);

        // Then
        assertThatThrownBy(() -> codec.decode(argsHeader.toBytes()))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("arguments");
        assertThatThrownBy(() -> codec.decode(kwargsHeader.toBytes()))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("keyword arguments");
    }
}
