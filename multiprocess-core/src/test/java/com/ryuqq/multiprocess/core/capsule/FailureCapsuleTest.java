package com.ryuqq.multiprocess.core.capsule;

import com.ryuqq.multiprocess.core.error.CapsuleException;
import com.ryuqq.multiprocess.core.error.RemoteWorkerException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FailureCapsule 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>포착: 종류, 메시지, 바깥 프레임 먼저</li>
 *   <li>재구성: 같은 종류/메시지, 합성 스택 트레이스, 원인 체인</li>
 *   <li>재구성 불가 종류는 CapsuleException / RemoteWorkerException 대체</li>
 *   <li>포착은 실패하지 않음 (순환 원인, 메시지 조회 실패)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FailureCapsuleTest {

    // ============================================================
    // 포착
    // ============================================================

    @Test
    void capture_종류와_메시지_기록() {
        // given
        IllegalArgumentException failure = throwBoom();

        // when
        FailureCapsule capsule = FailureCapsule.capture(failure);

        // then
        assertThat(capsule.kind()).isEqualTo("java.lang.IllegalArgumentException");
        assertThat(capsule.message()).isEqualTo("boom");
        assertThat(capsule.cause()).isNull();
    }

    @Test
    void capture_바깥_프레임부터_기록되고_마지막이_던진_위치() {
        // given
        IllegalArgumentException failure = throwBoom();

        // when
        FailureCapsule capsule = FailureCapsule.capture(failure);

        // then
        List<CapsuleFrame> frames = capsule.frames();
        assertThat(frames).hasSize(failure.getStackTrace().length);
        CapsuleFrame innermost = frames.get(frames.size() - 1);
        assertThat(innermost.methodName()).isEqualTo("throwBoom");
        assertThat(innermost.declaringClass()).isEqualTo(FailureCapsuleTest.class.getName());
        assertThat(innermost.lineNumber()).isEqualTo(failure.getStackTrace()[0].getLineNumber());
    }

    @Test
    void capture_null이면_예외() {
        assertThatThrownBy(() -> FailureCapsule.capture(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void capture_순환_원인도_종료됨() {
        // given
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second");
        first.initCause(second);
        second.initCause(first);

        // when
        FailureCapsule capsule = FailureCapsule.capture(first);

        // then
        assertThat(capsule.cause()).isNotNull();
        assertThat(capsule.cause().message()).isEqualTo("second");
        assertThat(capsule.cause().cause()).isNull();
    }

    @Test
    void capture_메시지_조회가_실패하면_null_메시지() {
        FailureCapsule capsule = FailureCapsule.capture(new ExplodingMessageException());

        assertThat(capsule.message()).isNull();
        assertThat(capsule.kind()).isEqualTo(ExplodingMessageException.class.getName());
    }

    // ============================================================
    // 재구성
    // ============================================================

    @Test
    void reconstruct_같은_종류와_메시지() {
        // given
        FailureCapsule capsule = FailureCapsule.capture(throwBoom());

        // when
        Throwable rebuilt = capsule.reconstruct();

        // then
        assertThat(rebuilt)
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("boom");
    }

    @Test
    void reconstruct_합성_스택_트레이스는_원래_순서() {
        // given
        IllegalArgumentException failure = throwBoom();
        FailureCapsule capsule = FailureCapsule.capture(failure);

        // when
        Throwable rebuilt = capsule.reconstruct();

        // then
        assertThat(Arrays.asList(rebuilt.getStackTrace()))
            .extracting(StackTraceElement::getMethodName)
            .containsExactlyElementsOf(
                Arrays.stream(failure.getStackTrace()).map(StackTraceElement::getMethodName).toList());
        assertThat(rebuilt.getStackTrace()[0].getLineNumber())
            .isEqualTo(failure.getStackTrace()[0].getLineNumber());
    }

    @Test
    void reconstruct_원인_체인_복원() {
        // given
        RuntimeException failure = new RuntimeException("outer", new IOException("inner"));

        // when
        Throwable rebuilt = FailureCapsule.capture(failure).reconstruct();

        // then
        assertThat(rebuilt).hasMessage("outer");
        assertThat(rebuilt.getCause())
            .isExactlyInstanceOf(IOException.class)
            .hasMessage("inner");
    }

    @Test
    void reconstruct_알_수_없는_종류면_CapsuleException() {
        FailureCapsule capsule = new FailureCapsule("com.example.NoSuchFailure", "gone", List.of(), null);

        assertThatThrownBy(capsule::reconstruct)
            .isInstanceOf(CapsuleException.class)
            .hasMessageContaining("com.example.NoSuchFailure");
    }

    @Test
    void reconstruct_Throwable이_아닌_종류면_CapsuleException() {
        FailureCapsule capsule = new FailureCapsule("java.lang.String", "text", List.of(), null);

        assertThatThrownBy(capsule::reconstruct)
            .isInstanceOf(CapsuleException.class)
            .hasMessageContaining("not a Throwable");
    }

    @Test
    void reconstruct_사용_가능한_생성자가_없으면_CapsuleException() {
        FailureCapsule capsule = FailureCapsule.capture(new CodeOnlyException(42));

        assertThatThrownBy(capsule::reconstruct)
            .isInstanceOf(CapsuleException.class)
            .hasMessageContaining("No usable constructor");
    }

    @Test
    void reconstructOrSubstitute_재구성_불가면_RemoteWorkerException() {
        // given
        CapsuleFrame frame = new CapsuleFrame("com.example.Remote", "work", "Remote.java", 12);
        FailureCapsule capsule = new FailureCapsule("com.example.NoSuchFailure", "gone", List.of(frame), null);

        // when
        Throwable substitute = capsule.reconstructOrSubstitute();

        // then
        assertThat(substitute)
            .isInstanceOf(RemoteWorkerException.class)
            .hasMessage("com.example.NoSuchFailure: gone");
        assertThat(((RemoteWorkerException) substitute).getKind()).isEqualTo("com.example.NoSuchFailure");
        assertThat(substitute.getStackTrace()[0].getClassName()).isEqualTo("com.example.Remote");
    }

    // ============================================================
    // Failures.storeAny
    // ============================================================

    @Test
    void storeAny_성공하면_빈_Optional() {
        assertThat(Failures.storeAny(() -> { })).isEmpty();
    }

    @Test
    void storeAny_Error도_포착() {
        Optional<FailureCapsule> capsule = Failures.storeAny(() -> {
            throw new AssertionError("expected 1 but was 2");
        });

        assertThat(capsule).isPresent();
        assertThat(capsule.get().kind()).isEqualTo("java.lang.AssertionError");
        assertThat(capsule.get().message()).isEqualTo("expected 1 but was 2");
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static IllegalArgumentException throwBoom() {
        try {
            throw new IllegalArgumentException("boom");
        } catch (IllegalArgumentException e) {
            return e;
        }
    }

    static class ExplodingMessageException extends RuntimeException {
        @Override
        public String getMessage() {
            throw new IllegalStateException("no message for you");
        }
    }

    static class CodeOnlyException extends RuntimeException {
        CodeOnlyException(int code) {
            super("code " + code);
        }
    }
}
