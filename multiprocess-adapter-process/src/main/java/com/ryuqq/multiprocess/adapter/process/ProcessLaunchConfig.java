package com.ryuqq.multiprocess.adapter.process;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * 워커 JVM 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>javaExecutable: java 실행 파일 경로 (기본: 현재 JVM의 java.home/bin/java)</li>
 *   <li>classpath: 워커 JVM 클래스패스 (기본: 현재 JVM의 java.class.path)</li>
 *   <li>jvmOptions: 추가 JVM 옵션 (기본: 없음, 예: -Xmx256m)</li>
 * </ul>
 *
 * <p>워커는 Coordinator와 같은 클래스패스에서 실행되어야 합니다.
 * 직렬화된 워커 팩토리를 역직렬화할 수 있어야 하기 때문입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param javaExecutable java 실행 파일 경로 (null/빈 문자열 불가)
 * @param classpath 클래스패스 (null/빈 문자열 불가)
 * @param jvmOptions 추가 JVM 옵션 (null이면 빈 목록)
 */
public record ProcessLaunchConfig(
    String javaExecutable,
    String classpath,
    List<String> jvmOptions
) {

    /**
     * 기본 설정 생성자 (현재 JVM 기준).
     */
    public ProcessLaunchConfig() {
        this(currentJavaExecutable(), System.getProperty("java.class.path"), List.of());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProcessLaunchConfig {
        if (javaExecutable == null || javaExecutable.isBlank()) {
            throw new IllegalArgumentException("javaExecutable cannot be null or blank");
        }
        if (classpath == null || classpath.isBlank()) {
            throw new IllegalArgumentException("classpath cannot be null or blank");
        }
        jvmOptions = jvmOptions == null ? List.of() : List.copyOf(jvmOptions);
    }

    /**
     * javaExecutable만 변경한 새 인스턴스 생성.
     */
    public ProcessLaunchConfig withJavaExecutable(String javaExecutable) {
        return new ProcessLaunchConfig(javaExecutable, classpath, jvmOptions);
    }

    /**
     * classpath만 변경한 새 인스턴스 생성.
     */
    public ProcessLaunchConfig withClasspath(String classpath) {
        return new ProcessLaunchConfig(javaExecutable, classpath, jvmOptions);
    }

    /**
     * jvmOptions만 변경한 새 인스턴스 생성.
     */
    public ProcessLaunchConfig withJvmOptions(List<String> jvmOptions) {
        return new ProcessLaunchConfig(javaExecutable, classpath, jvmOptions);
    }

    /**
     * 워커 JVM 실행 명령 생성.
     *
     * @param mainClass 메인 클래스 FQCN
     * @param arguments 프로그램 인자
     * @return 명령 (ProcessBuilder용)
     */
    List<String> command(String mainClass, List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classpath);
        command.add(mainClass);
        command.addAll(arguments);
        return command;
    }

    private static String currentJavaExecutable() {
        String executable = System.getProperty("os.name", "").toLowerCase().startsWith("windows") ? "java.exe" : "java";
        return System.getProperty("java.home") + File.separator + "bin" + File.separator + executable;
    }
}
