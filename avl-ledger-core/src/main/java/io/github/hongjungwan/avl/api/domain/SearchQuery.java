package io.github.hongjungwan.avl.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 레코드 검색 조건. null 필드는 필터링하지 않음. 결과는 최신순.
 */
@Getter
@Builder
public class SearchQuery {

    private final String slot;

    private final RecordKind kind;

    private final Instant since;

    @Builder.Default
    private final int limit = 100;
}
