package com.roadspeed.engine.dto;

import java.util.List;

/**
 * Per-item outcome of a batch ingest. Items are reported in request order.
 */
public record BatchIngestResult(
    int accepted,
    int rejected,
    List<ItemResult> items
) {

    public static BatchIngestResult of(List<ItemResult> items) {
        int accepted = (int) items.stream().filter(ItemResult::isAccepted).count();
        return new BatchIngestResult(accepted, items.size() - accepted, List.copyOf(items));
    }

    public enum Outcome {
        ACCEPTED,
        VALIDATION_FAILED,
        UNKNOWN_SEGMENT,
        STORE_UNAVAILABLE
    }

    /**
     * @param index  Position of the item in the request
     * @param obsId  Assigned id when accepted, null otherwise
     * @param outcome What happened to the item
     * @param reason Rejection reason, null when accepted
     */
    public record ItemResult(int index, Long obsId, Outcome outcome, String reason) {

        public static ItemResult accepted(int index, Long obsId) {
            return new ItemResult(index, obsId, Outcome.ACCEPTED, null);
        }

        public static ItemResult rejected(int index, Outcome outcome, String reason) {
            return new ItemResult(index, null, outcome, reason);
        }

        public boolean isAccepted() {
            return outcome == Outcome.ACCEPTED;
        }
    }
}
