package com.delta.redirects.resolve.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the payload accepted by the remote redirect API. The API names the
 * confidence field {@code precent}.
 */
public record DeliveryItem(
    String from,
    String to,
    @JsonProperty("precent") double percent) {}
