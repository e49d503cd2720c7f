package com.example.commitnotifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendCommitsResult {

    private String repoString;
    private int commitsFound;
    private int messagesSent;
}
