package com.accountdb.bancheck.check.api;

import com.accountdb.bancheck.check.model.CheckOptions;

import java.util.List;

public record SubmitSteamIdsRequest(
    List<String> steamIds,
    CheckOptions options
) {
}
