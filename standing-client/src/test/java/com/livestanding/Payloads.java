package com.livestanding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds snapshot payloads the way the producer sends them (camelCase JSON,
 * base64 match id).
 */
class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static byte[] matchBytes(String matchId) {
        return matchId.getBytes(StandardCharsets.UTF_8);
    }

    static Builder match(String matchId) {
        return new Builder(matchId);
    }

    static class Builder {

        private final ObjectNode root = MAPPER.createObjectNode();
        private final ArrayNode teams;
        private final ArrayNode roster;
        private final ArrayNode players;

        Builder(String matchId) {
            root.put("matchId", Base64.getEncoder().encodeToString(matchBytes(matchId)));
            root.put("tournamentId", "tournament-1");
            teams = root.putArray("teamStats");
            roster = root.putArray("totalTeamStats");
            players = root.putArray("playerStats");
            root.putArray("totalPlayerStats");
        }

        Builder tournament(String tournamentId) {
            root.put("tournamentId", tournamentId);
            return this;
        }

        /** Team in both the current match and the tournament roster. */
        Builder team(String name, long id, int rank, int placementRank, int kills, double score) {
            teams.add(teamNode(name, id, rank, placementRank, kills, score));
            roster.add(teamNode(name, id, rank, placementRank, kills, score));
            return this;
        }

        Builder team(String name, long id, int rank) {
            return team(name, id, rank, rank, 0, 10);
        }

        /** Team on the roster that does not play the current match. */
        Builder rosterOnly(String name, long id, int rank) {
            roster.add(teamNode(name, id, rank, rank, 0, 10));
            return this;
        }

        /** Sets the producer's eliminated flag on the current-match row of a team. */
        Builder eliminated(String teamName) {
            for (JsonNode team : teams) {
                if (team.get("name").asText().equals(teamName)) {
                    ((ObjectNode) team).put("eliminated", true);
                }
            }
            return this;
        }

        Builder player(String name, long teamId, String teamName, String deathType) {
            ObjectNode player = players.addObject();
            player.put("name", name);
            player.put("teamId", teamId);
            player.put("teamName", teamName);
            player.putObject("postDataPb").put("deathType", deathType);
            return this;
        }

        /** Four players of one team, all with the same death type. */
        Builder squad(String teamName, long teamId, String deathType) {
            for (int i = 1; i <= 4; i++) {
                player(teamName + "-p" + i, teamId, teamName, deathType);
            }
            return this;
        }

        Builder refresh(boolean refresh) {
            root.put("refresh", refresh);
            return this;
        }

        String build() {
            return root.toString();
        }

        private ObjectNode teamNode(String name, long id, int rank, int placementRank, int kills, double score) {
            ObjectNode team = MAPPER.createObjectNode();
            team.put("name", name);
            team.put("id", id);
            team.put("rank", rank);
            team.put("placementRank", placementRank);
            team.put("totalKills", kills);
            team.put("totalScore", score);
            return team;
        }
    }
}
