package com.tennis.api.dto;

import java.util.List;

/**
 * Head-to-head record with win counts, meetings most recent first.
 */
public record HeadToHeadResponse(
        String player1Id,
        String player1Name,
        int player1Wins,
        String player2Id,
        String player2Name,
        int player2Wins,
        int totalMatches,
        List<MeetingSummary> matches
) {
    public static HeadToHeadResponse create(
            String player1Id, String player1Name,
            String player2Id, String player2Name,
            List<MeetingSummary> matches
    ) {
        int p1Wins = 0;
        int p2Wins = 0;

        for (MeetingSummary match : matches) {
            if (player1Id.equals(match.winnerId())) {
                p1Wins++;
            } else if (player2Id.equals(match.winnerId())) {
                p2Wins++;
            }
        }

        return new HeadToHeadResponse(
                player1Id, player1Name, p1Wins,
                player2Id, player2Name, p2Wins,
                matches.size(), matches
        );
    }
}
