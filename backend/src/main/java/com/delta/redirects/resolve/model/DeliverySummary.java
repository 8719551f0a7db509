package com.delta.redirects.resolve.model;

public record DeliverySummary(
    boolean delivered,
    int sentCount,
    int created,
    int updated,
    int total,
    Integer httpStatus,
    String error) {

    public static DeliverySummary notSent(String error) {
        return new DeliverySummary(false, 0, 0, 0, 0, null, error);
    }
}
