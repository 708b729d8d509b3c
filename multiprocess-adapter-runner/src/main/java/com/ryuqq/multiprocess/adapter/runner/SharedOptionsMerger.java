package com.ryuqq.multiprocess.adapter.runner;

import com.ryuqq.multiprocess.core.model.Options;

import java.util.List;

/**
 * 기여 옵션을 공유 옵션으로 병합.
 *
 * <p>등록 순서대로 병합하며, 같은 키는 나중에 등록된 워커의 값이 이깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SharedOptionsMerger {

    private SharedOptionsMerger() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 순서 있는 병합.
     *
     * @param contributions 등록 순서의 기여 옵션 목록
     * @return 공유 옵션
     * @throws IllegalArgumentException contributions가 null인 경우
     */
    public static Options merge(List<Options> contributions) {
        if (contributions == null) {
            throw new IllegalArgumentException("contributions cannot be null");
        }
        Options shared = Options.empty();
        for (Options contribution : contributions) {
            if (contribution != null) {
                shared = shared.merge(contribution);
            }
        }
        return shared;
    }
}
