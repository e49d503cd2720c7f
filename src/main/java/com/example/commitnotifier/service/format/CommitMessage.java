package com.example.commitnotifier.service.format;

import com.example.commitnotifier.client.ClientModels.GitHubCommit;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * One Telegram message and the commits it reports
 */
@Getter
@RequiredArgsConstructor
public class CommitMessage {

    private final String text;
    private final List<GitHubCommit> commits;
}
