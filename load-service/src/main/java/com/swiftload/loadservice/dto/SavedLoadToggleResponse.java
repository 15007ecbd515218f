package com.swiftload.loadservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavedLoadToggleResponse {
    private UUID loadId;
    // true if the load is bookmarked after the call
    private boolean saved;
}
