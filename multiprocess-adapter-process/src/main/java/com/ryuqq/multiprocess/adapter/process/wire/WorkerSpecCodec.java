package com.ryuqq.multiprocess.adapter.process.wire;

import com.ryuqq.multiprocess.core.worker.WorkerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Base64;

/**
 * WorkerFactory를 프로세스 경계 너머로 보내기 위한 코덱.
 *
 * <p>Java 직렬화 후 Base64로 인코딩합니다. 람다 팩토리는 직렬화 가능한 함수형 인터페이스
 * ({@link WorkerFactory})로 선언되어야 하고, 캡처한 값도 모두 직렬화 가능해야 합니다.
 * 양쪽 프로세스는 같은 클래스패스를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerSpecCodec {

    private WorkerSpecCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 팩토리 인코딩.
     *
     * @param workerName 오류 메시지용 워커 이름
     * @param factory 팩토리
     * @return Base64 문자열
     * @throws WireFormatException 직렬화할 수 없는 경우 (예: 테스트 인스턴스를 캡처한 람다)
     */
    public static String encode(String workerName, WorkerFactory factory) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(factory);
        } catch (IOException e) {
            throw new WireFormatException(
                "Worker \"" + workerName + "\" cannot be sent to its process: " + e, e);
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    /**
     * 팩토리 디코딩 (워커 프로세스 쪽).
     *
     * @param encoded Base64 문자열
     * @return 팩토리
     * @throws IOException 바이트가 손상된 경우
     * @throws ClassNotFoundException 이 프로세스의 클래스패스에 없는 클래스인 경우
     */
    public static WorkerFactory decode(String encoded) throws IOException, ClassNotFoundException {
        byte[] bytes = Base64.getDecoder().decode(encoded);
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return (WorkerFactory) in.readObject();
        }
    }
}
