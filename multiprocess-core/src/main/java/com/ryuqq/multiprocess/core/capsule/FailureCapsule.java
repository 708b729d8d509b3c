package com.ryuqq.multiprocess.core.capsule;

import com.ryuqq.multiprocess.core.error.CapsuleException;
import com.ryuqq.multiprocess.core.error.RemoteWorkerException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 워커 프로세스에서 포착한 실패의 이식 가능한 표현.
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * 1. 워커에서 처리되지 않은 예외 발생
 * 2. capture(throwable) → 종류/메시지/프레임 기록 (바깥 프레임 먼저)
 * 3. 프로세스 경계를 한 번 넘어 전달 (평범한 직렬화 가능 값)
 * 4. Coordinator가 최대 한 번 소비: reconstruct() → 원래 타입의 예외 + 합성 스택 트레이스
 * </pre>
 *
 * <p>재구성은 best-effort입니다. 보고된 위치와 순서를 재현할 뿐 지역 변수 상태는 재현하지 않습니다.</p>
 *
 * @param kind 예외 클래스 FQCN
 * @param message 예외 메시지 (null 가능)
 * @param frames 호출 순서대로 기록된 프레임 (바깥 프레임 먼저)
 * @param cause 원인 예외의 캡슐 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FailureCapsule(
    String kind,
    String message,
    List<CapsuleFrame> frames,
    FailureCapsule cause
) {

    private static final int MAX_CAUSE_DEPTH = 16;

    public FailureCapsule {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        frames = frames == null ? List.of() : List.copyOf(frames);
    }

    /**
     * Throwable을 캡슐로 포착.
     *
     * <p>이 메서드는 실패하지 않습니다. 스택을 읽을 수 없으면 빈 프레임 목록으로,
     * 메시지를 읽을 수 없으면 null 메시지로 대체합니다.</p>
     *
     * @param throwable 포착할 예외
     * @return FailureCapsule
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static FailureCapsule capture(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        return capture(throwable, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    }

    private static FailureCapsule capture(Throwable throwable, Set<Throwable> seen, int depth) {
        seen.add(throwable);
        FailureCapsule cause = null;
        Throwable next = throwable.getCause();
        if (next != null && !seen.contains(next) && depth < MAX_CAUSE_DEPTH) {
            cause = capture(next, seen, depth + 1);
        }
        return new FailureCapsule(throwable.getClass().getName(), safeMessage(throwable), walkFrames(throwable), cause);
    }

    private static String safeMessage(Throwable throwable) {
        try {
            return throwable.getMessage();
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static List<CapsuleFrame> walkFrames(Throwable throwable) {
        StackTraceElement[] elements;
        try {
            elements = throwable.getStackTrace();
        } catch (RuntimeException e) {
            return List.of();
        }
        if (elements == null) {
            return List.of();
        }
        // Java는 안쪽 프레임이 먼저이므로 뒤집어서 바깥 프레임부터 기록
        List<CapsuleFrame> frames = new ArrayList<>(elements.length);
        for (int i = elements.length - 1; i >= 0; i--) {
            if (elements[i] != null) {
                frames.add(CapsuleFrame.from(elements[i]));
            }
        }
        return frames;
    }

    /**
     * 합성 스택 트레이스 (Java 순서: 안쪽 프레임 먼저).
     *
     * @return StackTraceElement 배열
     */
    public StackTraceElement[] stackTrace() {
        StackTraceElement[] trace = new StackTraceElement[frames.size()];
        for (int i = 0; i < trace.length; i++) {
            trace[i] = frames.get(frames.size() - 1 - i).toStackTraceElement();
        }
        return trace;
    }

    /**
     * 원래 종류/메시지를 가진 예외로 재구성.
     *
     * <p>생성자 탐색 순서: (String) → (String, Throwable) → (Object) → ().
     * 원인 캡슐은 재귀적으로 재구성되며, 원인 쪽이 재구성 불가하면
     * {@link RemoteWorkerException}으로 대체됩니다.</p>
     *
     * @return 재구성된 예외 (합성 스택 트레이스 포함)
     * @throws CapsuleException 원래 종류를 이쪽에서 재생성할 수 없는 경우
     */
    public Throwable reconstruct() {
        Class<? extends Throwable> type = resolveType();
        Throwable rebuiltCause = cause == null ? null : cause.reconstructOrSubstitute();
        Throwable rebuilt = instantiate(type, rebuiltCause);
        rebuilt.setStackTrace(stackTrace());
        return rebuilt;
    }

    /**
     * 재구성하되, 불가능하면 {@link RemoteWorkerException}으로 대체.
     *
     * @return 재구성된 예외 또는 대체 예외
     */
    public Throwable reconstructOrSubstitute() {
        try {
            return reconstruct();
        } catch (CapsuleException e) {
            RemoteWorkerException substitute = new RemoteWorkerException(kind, message);
            substitute.setStackTrace(stackTrace());
            if (cause != null) {
                substitute.initCause(cause.reconstructOrSubstitute());
            }
            return substitute;
        }
    }

    private Class<? extends Throwable> resolveType() {
        Class<?> type;
        try {
            type = Class.forName(kind, false, classLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new CapsuleException(kind, "Unknown failure kind: " + kind, e);
        }
        if (!Throwable.class.isAssignableFrom(type)) {
            throw new CapsuleException(kind, "Failure kind is not a Throwable: " + kind, null);
        }
        return type.asSubclass(Throwable.class);
    }

    private Throwable instantiate(Class<? extends Throwable> type, Throwable rebuiltCause) {
        try {
            Constructor<? extends Throwable> withMessage = findConstructor(type, String.class);
            if (withMessage != null) {
                return attachCause(withMessage.newInstance(message), rebuiltCause);
            }
            Constructor<? extends Throwable> withMessageAndCause = findConstructor(type, String.class, Throwable.class);
            if (withMessageAndCause != null) {
                return withMessageAndCause.newInstance(message, rebuiltCause);
            }
            Constructor<? extends Throwable> withObject = findConstructor(type, Object.class);
            if (withObject != null) {
                return attachCause(withObject.newInstance(message), rebuiltCause);
            }
            Constructor<? extends Throwable> noArg = findConstructor(type);
            if (noArg != null && message == null) {
                return attachCause(noArg.newInstance(), rebuiltCause);
            }
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new CapsuleException(kind, "Failed to recreate failure kind: " + kind, e);
        }
        throw new CapsuleException(kind, "No usable constructor for failure kind: " + kind, null);
    }

    private static Throwable attachCause(Throwable rebuilt, Throwable rebuiltCause) {
        if (rebuiltCause == null || rebuilt.getCause() == rebuiltCause) {
            return rebuilt;
        }
        try {
            rebuilt.initCause(rebuiltCause);
        } catch (IllegalStateException e) {
            // 생성자가 이미 cause를 고정한 타입
            rebuilt.addSuppressed(rebuiltCause);
        }
        return rebuilt;
    }

    private static Constructor<? extends Throwable> findConstructor(Class<? extends Throwable> type, Class<?>... parameterTypes) {
        try {
            Constructor<? extends Throwable> constructor = type.getDeclaredConstructor(parameterTypes);
            return constructor.trySetAccessible() ? constructor : null;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static ClassLoader classLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return loader != null ? loader : FailureCapsule.class.getClassLoader();
    }

    @Override
    public String toString() {
        return "FailureCapsule{" + kind + (message == null ? "" : ": " + message) + ", " + frames.size() + " frames}";
    }
}
