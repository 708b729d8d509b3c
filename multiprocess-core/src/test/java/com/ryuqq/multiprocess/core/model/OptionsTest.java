package com.ryuqq.multiprocess.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Options 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OptionsTest {

    // ============================================================
    // 생성
    // ============================================================

    @Test
    void of_null_맵이면_빈_Options() {
        assertThat(Options.of(null)).isSameAs(Options.empty());
    }

    @Test
    void of_원본_맵을_변경해도_영향_없음() {
        // given
        Map<String, Object> source = new HashMap<>();
        source.put("a", 1);

        // when
        Options options = Options.of(source);
        source.put("b", 2);

        // then
        assertThat(options.keys()).containsExactly("a");
    }

    @Test
    void of_빈_키면_예외() {
        assertThatThrownBy(() -> Options.of(" ", 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key");
    }

    @Test
    void of_null_값은_허용() {
        Options options = Options.of("nothing", null);

        assertThat(options.containsKey("nothing")).isTrue();
        assertThat(options.get("nothing")).isNull();
    }

    @Test
    void asMap_변경_불가() {
        Options options = Options.of("a", 1);

        assertThatThrownBy(() -> options.asMap().put("b", 2))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    // ============================================================
    // 값 정규화
    // ============================================================

    @Test
    void of_정수는_Long으로_정규화() {
        // when
        Options options = Options.of(Map.of("i", 7, "s", (short) 8));

        // then
        assertThat(options.get("i")).isInstanceOf(Long.class).isEqualTo(7L);
        assertThat(options.get("s")).isInstanceOf(Long.class).isEqualTo(8L);
        assertThat(Options.of("n", 1)).isEqualTo(Options.of("n", 1L));
    }

    @Test
    void of_Float는_십진_표기대로_Double로_정규화() {
        Options options = Options.of("ratio", 0.1f);

        assertThat(options.get("ratio")).isEqualTo(0.1d);
    }

    @Test
    void of_중첩_값도_정규화() {
        // given
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("port", 9000);
        nested.put("tags", List.of(1, "a"));

        // when
        Options options = Options.of("server", nested);

        // then
        assertThat(options.get("server")).isEqualTo(Map.of("port", 9000L, "tags", List.of(1L, "a")));
    }

    @Test
    void of_JSON_타입이_아닌_값은_거부() {
        assertThatThrownBy(() -> Options.of("bean", new Object()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bean")
            .hasMessageContaining("java.lang.Object");

        assertThatThrownBy(() -> Options.of("amount", new BigDecimal("1.5")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_중첩된_잘못된_값은_경로와_함께_거부() {
        Map<String, Object> nested = Map.of("items", List.of("ok", Thread.State.NEW));

        assertThatThrownBy(() -> Options.of("config", nested))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config.items[1]");
    }

    @Test
    void of_문자열이_아닌_Map_키는_거부() {
        assertThatThrownBy(() -> Options.of("lookup", Map.of(1, "one")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("string keys");
    }

    @Test
    void of_유한하지_않은_숫자는_거부() {
        assertThatThrownBy(() -> Options.of("x", Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Options.of("x", Double.POSITIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 중첩된_List와_Map도_변경_불가() {
        // given
        List<Object> hosts = new ArrayList<>(List.of("a"));
        Map<String, Object> limits = new HashMap<>(Map.of("max", 1));
        Options options = Options.of("hosts", hosts, "limits", limits);

        // when: 원본을 바꿔도 영향 없음
        hosts.add("b");
        limits.put("min", 0);

        // then
        assertThat(options.get("hosts")).isEqualTo(List.of("a"));
        assertThat(options.get("limits")).isEqualTo(Map.of("max", 1L));
        @SuppressWarnings("unchecked")
        List<Object> exposedHosts = (List<Object>) options.asMap().get("hosts");
        @SuppressWarnings("unchecked")
        Map<String, Object> exposedLimits = (Map<String, Object>) options.asMap().get("limits");
        assertThatThrownBy(() -> exposedHosts.add("c"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> exposedLimits.put("min", 0))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 중첩_List의_null_원소는_허용() {
        Options options = Options.of("values", Arrays.asList("a", null));

        assertThat((List<Object>) options.get("values")).containsExactly("a", null);
    }

    // ============================================================
    // 병합
    // ============================================================

    @Test
    void merge_서로_다른_키는_합집합() {
        // given
        Options first = Options.of("a", 1);
        Options second = Options.of("b", 2);

        // when
        Options merged = first.merge(second);

        // then
        assertThat(merged.asMap()).containsExactly(Map.entry("a", 1L), Map.entry("b", 2L));
    }

    @Test
    void merge_충돌_키는_나중_값이_이김() {
        // given
        Options first = Options.of("x", "first", "a", 1);
        Options second = Options.of("x", "second");

        // when
        Options merged = first.merge(second);

        // then
        assertThat(merged.get("x")).isEqualTo("second");
        assertThat(merged.keys()).containsExactly("x", "a");
    }

    @Test
    void merge_원본은_변경되지_않음() {
        Options first = Options.of("a", 1);

        first.merge(Options.of("a", 2));

        assertThat(first.get("a")).isEqualTo(1L);
    }

    @Test
    void merge_null이면_예외() {
        assertThatThrownBy(() -> Options.empty().merge(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 타입별 조회
    // ============================================================

    @Test
    void getInt_Long_값도_int로_변환() {
        Options options = Options.of("port", 9000L);

        assertThat(options.getInt("port")).isEqualTo(9000);
    }

    @Test
    void getInt_int_범위를_벗어나면_예외() {
        Options options = Options.of("big", 5_000_000_000L);

        assertThatThrownBy(() -> options.getInt("big"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("does not fit in int");
        assertThat(options.getLong("big")).isEqualTo(5_000_000_000L);
    }

    @Test
    void getInt_소수부가_있으면_예외() {
        Options options = Options.of("ratio", 2.5);

        assertThatThrownBy(() -> options.getInt("ratio"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not an integral number");
    }

    @Test
    void getInt_소수부가_없는_Double은_허용() {
        assertThat(Options.of("count", 3.0).getInt("count")).isEqualTo(3);
    }

    @Test
    void getInt_값이_없으면_예외() {
        assertThatThrownBy(() -> Options.empty().getInt("missing"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void getInt_숫자가_아니면_예외() {
        Options options = Options.of("port", "9000");

        assertThatThrownBy(() -> options.getInt("port"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("port");
    }

    @Test
    void getString_문자열이_아니면_예외() {
        Options options = Options.of("name", List.of("a"));

        assertThatThrownBy(() -> options.getString("name"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void getOrDefault_없는_키면_기본값() {
        assertThat(Options.empty().getOrDefault("missing", "fallback")).isEqualTo("fallback");
    }

    @Test
    void equals_같은_내용이면_동등() {
        assertThat(Options.of("a", 1)).isEqualTo(Options.of(Map.of("a", 1)));
        assertThat(Options.of("a", 1)).hasSameHashCodeAs(Options.of(Map.of("a", 1)));
    }
}
