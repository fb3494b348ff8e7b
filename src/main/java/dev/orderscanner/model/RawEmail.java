package dev.orderscanner.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RawEmail {
    String id;
    String subject;
    String sender;
    String date; // raw Date header
    String snippet;
    String body;
}
