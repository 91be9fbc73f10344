package com.docintake.scanfailures.controller;

import com.docintake.scanfailures.domain.FailureStats;
import java.util.List;

public record FailureListResponse(List<SourceFailureResponse> failures, FailureStats stats) {
}
