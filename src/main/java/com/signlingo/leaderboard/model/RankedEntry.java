package com.signlingo.leaderboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedEntry {
    private String id;
    private String username;
    private String avatar;
    private Long score;
    /** 1-based dense rank. */
    private Long position;

    public static RankedEntry of(ScoreRecord record, long position) {
        return RankedEntry.builder()
            .id(record.getId())
            .username(record.getUsername())
            .avatar(record.getAvatar())
            .score(record.getScore())
            .position(position)
            .build();
    }
}
