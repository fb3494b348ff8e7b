package dev.orderscanner.controller.dto;

public record DigestResponse(String ownerKey, int itemCount, boolean sent) {
}
