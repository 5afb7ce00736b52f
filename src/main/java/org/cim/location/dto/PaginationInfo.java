package org.cim.location.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Paging details of a list response.
 *
 * @param limit maximum number of results per page
 * @param offset number of results skipped
 * @param hasMore whether a further page exists
 */
@Schema(
    description = "Pagination metadata",
    example = "{\"limit\":100,\"offset\":0,\"hasMore\":false}"
)
public record PaginationInfo(
    @Schema(description = "Maximum number of results per page", example = "100")
    int limit,
    @Schema(description = "Number of results skipped", example = "0")
    int offset,
    @Schema(description = "Whether more results are available", example = "false")
    boolean hasMore
) {
}
