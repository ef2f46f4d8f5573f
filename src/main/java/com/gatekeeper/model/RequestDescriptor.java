package com.gatekeeper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the admission check needs to know about one inbound request. {@code ip} and
 * {@code userId} may be null; the matching dimensions are then skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestDescriptor {
    private String ip;
    private String userId;
    private String tier;
    private String endpoint;
}
