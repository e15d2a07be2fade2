package org.seleznyov.iyu.tracepipe.core.ingest;

import org.junit.jupiter.api.Test;
import org.seleznyov.iyu.tracepipe.domain.model.event.MessagePayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.MetricPayload;
import org.seleznyov.iyu.tracepipe.domain.model.event.StateDiff;
import org.seleznyov.iyu.tracepipe.domain.model.event.TruncatedValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadTruncatorTest {

    private final PayloadTruncator truncator = new PayloadTruncator(64);

    @Test
    void smallValuesPassThroughUnchanged() {
        List<Integer> args = List.of(1, 2, 3);

        assertThat(truncator.truncate((Object) args)).isSameAs(args);
        assertThat(truncator.truncate((Object) "short")).isEqualTo("short");
        assertThat(truncator.truncate((Object) null)).isNull();
        assertThat(truncator.truncatedValues()).isZero();
    }

    @Test
    void oversizedValuesAreReplacedWithTypeHintedMarker() {
        String text = "x".repeat(100);
        List<String> list = Collections.nCopies(20, "abcdef");

        Object truncatedText = truncator.truncate((Object) text);
        Object truncatedList = truncator.truncate((Object) list);
        Object truncatedArray = truncator.truncate((Object) new int[100]);

        assertThat(truncatedText).isEqualTo(new TruncatedValue(100, "String"));
        assertThat(truncatedList).isInstanceOfSatisfying(TruncatedValue.class, marker -> {
            assertThat(marker.typeHint()).isEqualTo("List");
            assertThat(marker.originalSize()).isGreaterThan(64);
            assertThat(marker.truncated()).isTrue();
        });
        assertThat(truncatedArray).isInstanceOfSatisfying(TruncatedValue.class,
            marker -> assertThat(marker.typeHint()).isEqualTo("int[]"));
        assertThat(truncator.truncatedValues()).isEqualTo(3);
    }

    @Test
    void contentHashIsStableForEqualMapsRegardlessOfInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", 1);
        Map<String, Object> second = new TreeMap<>(first);

        assertThat(truncator.contentHash(first)).isEqualTo(truncator.contentHash(second));
        assertThat(truncator.contentHash("ping")).isNotEqualTo(truncator.contentHash("pong"));
    }

    @Test
    void messageHashIsTakenFromFullContentBeforeTruncation() {
        String content = "y".repeat(500);
        MessagePayload payload = new MessagePayload("p1", "p2", content, 0L);

        MessagePayload truncated = (MessagePayload) truncator.truncate(payload);

        assertThat(truncated.content()).isInstanceOf(TruncatedValue.class);
        assertThat(truncated.contentHash()).isEqualTo(truncator.contentHash(content));
    }

    @Test
    void metricMetadataIsTruncatedPerValue() {
        MetricPayload payload = new MetricPayload("latency", 1.5, Map.of("host", "h1", "dump", "z".repeat(200)));

        MetricPayload truncated = (MetricPayload) truncator.truncate(payload);

        assertThat(truncated.metadata().get("host")).isEqualTo("h1");
        assertThat(truncated.metadata().get("dump")).isInstanceOf(TruncatedValue.class);
    }

    @Test
    void diffReportsChangeAndSizeDelta() {
        assertThat(truncator.diff(Map.of("a", 1), Map.of("a", 1))).isEqualTo(StateDiff.NO_CHANGE);
        assertThat(truncator.diff("ab", "abcd")).isEqualTo(StateDiff.changed(2));
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new PayloadTruncator(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
