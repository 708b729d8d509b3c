package com.ryuqq.multiprocess.core.worker;

import com.ryuqq.multiprocess.core.model.Options;

/**
 * {@link WorkerFunctions}에 위임하는 워커 유닛.
 */
final class ComposedWorker extends WorkerUnit {

    private final WorkerFunctions functions;
    private Options sharedOptions = Options.empty();

    ComposedWorker(WorkerFunctions functions) {
        this.functions = functions;
    }

    @Override
    public Options contribute() throws Exception {
        Options contribution = functions.contribute().contribute(initialOptions());
        return contribution == null ? Options.empty() : contribution;
    }

    @Override
    public void setup(Options sharedOptions) throws Exception {
        this.sharedOptions = sharedOptions;
        functions.setup().setup(initialOptions(), sharedOptions);
    }

    @Override
    public void run() throws Exception {
        functions.body().run(initialOptions(), sharedOptions);
    }

    @Override
    public void teardown() throws Exception {
        functions.teardown().teardown();
    }
}
