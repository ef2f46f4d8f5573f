package com.gatekeeper.dto;

import com.gatekeeper.model.RequestDescriptor;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdmissionRequest {

    @Size(max = 64, message = "IP address cannot exceed 64 characters")
    private String ip;

    @Size(max = 256, message = "User id cannot exceed 256 characters")
    private String userId;

    @Size(max = 64, message = "Tier cannot exceed 64 characters")
    private String tier;

    @Size(max = 2048, message = "Endpoint cannot exceed 2048 characters")
    private String endpoint;

    public RequestDescriptor toDescriptor() {
        return RequestDescriptor.builder()
                .ip(ip)
                .userId(userId)
                .tier(tier)
                .endpoint(endpoint)
                .build();
    }
}
