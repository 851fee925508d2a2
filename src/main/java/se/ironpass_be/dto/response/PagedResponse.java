package se.ironpass_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.Map;

/**
 * One page of a list endpoint, with the filters that produced it echoed back.
 */
@Getter
@AllArgsConstructor
public class PagedResponse<T> {
    private final List<T> content;
    private final PageMetadata pagination;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final Map<String, Object> filters;

    @Getter
    @AllArgsConstructor
    public static class PageMetadata {
        private final int currentPage;
        private final int pageSize;
        private final int totalPages;
        private final long totalElements;

        static PageMetadata from(Page<?> page) {
            return new PageMetadata(page.getNumber(), page.getSize(), page.getTotalPages(), page.getTotalElements());
        }
    }

    public static <T> PagedResponse<T> of(Page<T> page) {
        return of(page, Map.of());
    }

    public static <T> PagedResponse<T> of(Page<T> page, Map<String, Object> filters) {
        return new PagedResponse<>(page.getContent(), PageMetadata.from(page), filters);
    }
}
