package com.example.commitnotifier.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRepositoryRequest {

    @NotNull(message = "Notification interval is required")
    private Integer notificationInterval;
}
