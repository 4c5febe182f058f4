package com.umitunal.elric.serialization;

import com.umitunal.elric.core.JobCodecException;
import com.umitunal.elric.model.JobDescriptor;
import com.umitunal.elric.trigger.CronTrigger;
import com.umitunal.elric.trigger.DateTrigger;
import com.umitunal.elric.trigger.IntervalTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JsonJobCodecTest {

    private final JsonJobCodec codec = new JsonJobCodec();

    @Test
    @DisplayName("Should round-trip a fully populated job")
    void testFullJob() {
        // Given
        JobDescriptor original = JobDescriptor.builder("job-1", "reports.build")
                .args(List.of("sales", 3, true))
                .kwargs(Map.of("format", "csv", "tags", List.of("a", "b")))
                .trigger(new IntervalTrigger(1000, 500, 9000L))
                .nextRunTime(1500L)
                .filter("tenant", "acme")
                .build();

        // When
        JobDescriptor decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded).isEqualTo(original);
    }

    @Test
    @DisplayName("Should keep the trigger variant and its parameters")
    void testTriggerVariants() {
        JobDescriptor date = JobDescriptor.builder("d", "f").trigger(new DateTrigger(42)).nextRunTime(42L).build();
        JobDescriptor cron = JobDescriptor.builder("c", "f")
                .trigger(new CronTrigger("0 0 * * * *", 7000))
                .nextRunTime(3600000L)
                .build();

        assertThat(codec.decode(codec.encode(date)).getTrigger()).isEqualTo(new DateTrigger(42));
        assertThat(codec.decode(codec.encode(cron)).getTrigger()).isEqualTo(new CronTrigger("0 0 * * * *", 7000));
    }

    @Test
    @DisplayName("Should write an explicit versioned schema")
    void testSchemaLayout() {
        JobDescriptor job = JobDescriptor.builder("once", "task").build();

        String json = new String(codec.encode(job), UTF_8);

        assertThat(json).contains("\"v\":1", "\"id\":\"once\"", "\"func\":\"task\"",
                "\"trigger\":null", "\"nextRunTime\":null");
        assertThat(codec.schemaVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject unknown schema versions")
    void testUnknownVersion() {
        byte[] bytes = "{\"v\":2,\"id\":\"x\",\"func\":\"f\"}".getBytes(UTF_8);

        assertThatThrownBy(() -> codec.decode(bytes))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("version");
    }

    @Test
    @DisplayName("Should reject unknown trigger tags")
    void testUnknownTriggerTag() {
        byte[] bytes = "{\"v\":1,\"id\":\"x\",\"func\":\"f\",\"trigger\":{\"type\":\"weekly\"}}".getBytes(UTF_8);

        assertThatThrownBy(() -> codec.decode(bytes))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("weekly");
    }

    @Test
    @DisplayName("Should reject garbage and missing fields")
    void testMalformedInput() {
        assertThatThrownBy(() -> codec.decode("not json".getBytes(UTF_8)))
                .isInstanceOf(JobCodecException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]".getBytes(UTF_8)))
                .isInstanceOf(JobCodecException.class);
        assertThatThrownBy(() -> codec.decode("{\"v\":1,\"func\":\"f\"}".getBytes(UTF_8)))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("'id'");
        assertThatThrownBy(() -> codec.decode(
                "{\"v\":1,\"id\":\"x\",\"func\":\"f\",\"trigger\":{\"type\":\"interval\",\"start\":0,\"interval\":0}}"
                        .getBytes(UTF_8)))
                .isInstanceOf(JobCodecException.class);
    }

    @Test
    @DisplayName("Should reject non-numeric times instead of reading them as zero")
    void testNonNumericTimes() {
        byte[] badNextRun = ("{\"v\":1,\"id\":\"x\",\"func\":\"f\","
                + "\"trigger\":{\"type\":\"date\",\"runTime\":5},\"nextRunTime\":\"soon\"}").getBytes(UTF_8);
        byte[] badEnd = ("{\"v\":1,\"id\":\"x\",\"func\":\"f\",\"nextRunTime\":5,"
                + "\"trigger\":{\"type\":\"interval\",\"start\":0,\"interval\":5,\"end\":\"later\"}}").getBytes(UTF_8);
        byte[] fractional = ("{\"v\":1,\"id\":\"x\",\"func\":\"f\",\"nextRunTime\":5.5,"
                + "\"trigger\":{\"type\":\"date\",\"runTime\":5}}").getBytes(UTF_8);

        assertThatThrownBy(() -> codec.decode(badNextRun))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("'nextRunTime'");
        assertThatThrownBy(() -> codec.decode(badEnd))
                .isInstanceOf(JobCodecException.class)
                .hasMessageContaining("'end'");
        assertThatThrownBy(() -> codec.decode(fractional))
                .isInstanceOf(JobCodecException.class);
    }
}
