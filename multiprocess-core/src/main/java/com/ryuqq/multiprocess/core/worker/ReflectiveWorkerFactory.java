package com.ryuqq.multiprocess.core.worker;

import java.lang.reflect.Constructor;

/**
 * 인자 없는 생성자로 워커 클래스를 인스턴스화하는 팩토리.
 */
final class ReflectiveWorkerFactory implements WorkerFactory {

    private static final long serialVersionUID = 1L;

    private final Class<? extends WorkerUnit> type;

    ReflectiveWorkerFactory(Class<? extends WorkerUnit> type) {
        this.type = type;
    }

    @Override
    public WorkerUnit create() throws Exception {
        Constructor<? extends WorkerUnit> constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }

    @Override
    public String toString() {
        return "ReflectiveWorkerFactory{" + type.getName() + '}';
    }
}
