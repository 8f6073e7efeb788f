package fr.lapetina.bulkwriter.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Response to one batch call. Outcome {@code i} belongs to payload {@code i} of the request;
 * position is the only correlation between the two.
 */
public record BatchWriteResponse(List<ItemOutcome> outcomes) {

    public BatchWriteResponse {
        Objects.requireNonNull(outcomes, "Outcomes are required");
        outcomes = List.copyOf(outcomes);
    }

    public static BatchWriteResponse of(ItemOutcome... outcomes) {
        return new BatchWriteResponse(List.of(outcomes));
    }

    public int size() {
        return outcomes.size();
    }

    public ItemOutcome get(int index) {
        return outcomes.get(index);
    }
}
