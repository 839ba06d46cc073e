package com.livestanding.snapshot;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * Decoded state of one delivery.
 *
 * - teams / players: the current match only
 * - roster / totalPlayers: cumulative tournament standings
 * - refresh: producer-side request for a full rebuild
 *
 * Immutable: the match id is copied in and out, the lists are unmodifiable.
 */
public class MatchSnapshot {

    private final byte[] matchId;
    private final String tournamentId;
    private final List<TeamRecord> teams;
    private final List<TeamRecord> roster;
    private final List<PlayerRecord> players;
    private final List<PlayerRecord> totalPlayers;
    private final boolean refresh;

    public MatchSnapshot(byte[] matchId, String tournamentId,
                         List<TeamRecord> teams, List<TeamRecord> roster,
                         List<PlayerRecord> players, List<PlayerRecord> totalPlayers,
                         boolean refresh) {
        this.matchId = matchId.clone();
        this.tournamentId = tournamentId;
        this.teams = List.copyOf(teams);
        this.roster = List.copyOf(roster);
        this.players = List.copyOf(players);
        this.totalPlayers = List.copyOf(totalPlayers);
        this.refresh = refresh;
    }

    public byte[] getMatchId() {
        return matchId.clone();
    }

    public String getTournamentId() {
        return tournamentId;
    }

    public List<TeamRecord> getTeams() {
        return teams;
    }

    public List<TeamRecord> getRoster() {
        return roster;
    }

    public List<PlayerRecord> getPlayers() {
        return players;
    }

    public List<PlayerRecord> getTotalPlayers() {
        return totalPlayers;
    }

    public boolean isRefresh() {
        return refresh;
    }

    /**
     * Match id as dash separated hex, for logs.
     */
    public String matchIdHex() {
        return HexFormat.ofDelimiter("-").formatHex(matchId);
    }

    public boolean hasMatchId(byte[] other) {
        return Arrays.equals(matchId, other);
    }

    @Override
    public String toString() {
        return "MatchSnapshot{" +
                "matchId=" + matchIdHex() +
                ", tournamentId='" + tournamentId + '\'' +
                ", teams=" + teams.size() +
                ", roster=" + roster.size() +
                ", players=" + players.size() +
                ", refresh=" + refresh +
                '}';
    }
}
