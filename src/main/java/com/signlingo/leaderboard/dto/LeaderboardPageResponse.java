package com.signlingo.leaderboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signlingo.leaderboard.model.RankedEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardPageResponse {
    private List<RankedEntry> items;
    private int page;

    @JsonProperty("page_size")
    private int pageSize;
}
