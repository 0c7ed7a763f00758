package com.newsroom.newsletter.model;

import java.util.UUID;

/** 登録した issue と、その時点で配信対象になった購読者数。 */
public record EnqueuedIssue(UUID issueId, int subscribersAtPublish) {}
