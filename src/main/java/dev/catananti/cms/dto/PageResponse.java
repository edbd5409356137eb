package dev.catananti.cms.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {
    private List<T> items;
    private Pagination pagination;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Pagination {
        private int skip;
        private int limit;
        private long total;
        private boolean hasNext;
    }

    /**
     * Offset-based page: {@code has_next} is true while items remain past {@code skip + limit}.
     */
    public static <T> PageResponse<T> of(List<T> items, int skip, int limit, long total) {
        return PageResponse.<T>builder()
                .items(items)
                .pagination(Pagination.builder()
                        .skip(skip)
                        .limit(limit)
                        .total(total)
                        .hasNext((long) skip + limit < total)
                        .build())
                .build();
    }
}
