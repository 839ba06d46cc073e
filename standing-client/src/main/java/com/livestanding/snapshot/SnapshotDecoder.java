package com.livestanding.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Turns a payload string into a validated {@link MatchSnapshot}.
 *
 * The payload is the JSON form of the producer's observer message. Field names
 * are accepted in lowerCamelCase (protobuf JSON mapping) and snake_case:
 * {
 *     "matchId": "/a8hSDOsTv+9zRmUOiX6eQ==",
 *     "tournamentId": "as-pws2gf",
 *     "teamStats": [ ... ],
 *     "totalTeamStats": [ ... ],
 *     "playerStats": [ ... ],
 *     "totalPlayerStats": [ ... ],
 *     "refresh": false
 * }
 *
 * Uses Jackson's tree model so that lenient fields (ids as numbers or numeric
 * strings, optional telemetry blocks) can be read without a rigid binding.
 * Thread-safe.
 */
public class SnapshotDecoder {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotDecoder.class);

    private final ObjectMapper objectMapper;

    public SnapshotDecoder() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @throws SnapshotValidationException if the payload is not JSON or misses required fields
     */
    public MatchSnapshot decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new SnapshotValidationException("Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SnapshotValidationException("Payload is not a JSON object");
        }

        String tournamentId = text(field(root, "tournamentId", "tournament_id"));
        if (tournamentId == null || tournamentId.isEmpty()) {
            throw new SnapshotValidationException("Missing tournamentId");
        }

        byte[] matchId = matchId(field(root, "matchId", "match_id"));

        List<TeamRecord> teams = teams(field(root, "teamStats", "team_stats"), "teamStats");
        List<TeamRecord> roster = teams(field(root, "totalTeamStats", "total_team_stats"), "totalTeamStats");
        List<PlayerRecord> players = players(field(root, "playerStats", "player_stats"), "playerStats");
        List<PlayerRecord> totalPlayers = players(field(root, "totalPlayerStats", "total_player_stats"), "totalPlayerStats");

        JsonNode refreshNode = root.get("refresh");
        boolean refresh = refreshNode != null && refreshNode.asBoolean(false);

        MatchSnapshot snapshot = new MatchSnapshot(matchId, tournamentId, teams, roster, players, totalPlayers, refresh);
        logger.debug("Decoded {}", snapshot);
        return snapshot;
    }

    // === Fields ===

    private byte[] matchId(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new SnapshotValidationException("Missing matchId");
        }
        if (node.isArray()) {
            byte[] bytes = new byte[node.size()];
            for (int i = 0; i < node.size(); i++) {
                bytes[i] = (byte) node.get(i).asInt();
            }
            return bytes;
        }
        if (!node.isTextual() || node.asText().isEmpty()) {
            throw new SnapshotValidationException("matchId must be a non-empty string");
        }

        // bytes fields are base64 in the protobuf JSON mapping; plain ids are taken verbatim.
        // Only canonical base64 is decoded, so distinct ids never share bytes.
        String text = node.asText();
        try {
            byte[] decoded = Base64.getDecoder().decode(text);
            if (Base64.getEncoder().encodeToString(decoded).equals(text)) {
                return decoded;
            }
        } catch (IllegalArgumentException e) {
            logger.trace("matchId {} is not base64, using its UTF-8 bytes", text);
        }
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private List<TeamRecord> teams(JsonNode node, String listName) {
        List<TeamRecord> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw new SnapshotValidationException(listName + " is not an array");
        }

        for (JsonNode team : node) {
            String name = text(team.get("name"));
            if (name == null || name.isEmpty()) {
                throw new SnapshotValidationException("Team without name in " + listName);
            }

            JsonNode rankNode = team.get("rank");
            if (rankNode == null || !rankNode.isNumber()) {
                throw new SnapshotValidationException("Team " + name + " has a non-numeric rank: " + rankNode);
            }
            int rank = rankNode.asInt();

            JsonNode placementNode = field(team, "placementRank", "placement_rank");
            int placementRank = placementNode != null && placementNode.isNumber() ? placementNode.asInt() : rank;

            long id = numericId(field(team, "id", "team_id", "teamId"));
            if (id == 0) {
                id = idFromName(name);
            }

            JsonNode eliminatedNode = team.get("eliminated");
            boolean eliminated = eliminatedNode != null && eliminatedNode.asBoolean(false);

            result.add(TeamRecord.builder()
                    .name(name)
                    .id(id)
                    .rank(rank)
                    .placementRank(placementRank)
                    .totalKills(intValue(field(team, "totalKills", "total_kills")))
                    .totalScore(doubleValue(field(team, "totalScore", "total_score")))
                    .eliminated(eliminated)
                    .build());
        }
        return result;
    }

    private List<PlayerRecord> players(JsonNode node, String listName) {
        List<PlayerRecord> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw new SnapshotValidationException(listName + " is not an array");
        }

        for (JsonNode player : node) {
            result.add(new PlayerRecord(
                    text(player.get("name")),
                    numericId(field(player, "teamId", "team_id")),
                    text(field(player, "teamName", "team_name")),
                    status(player)));
        }
        return result;
    }

    /**
     * Death type first, then live telemetry, else alive.
     */
    private PlayerStatus status(JsonNode player) {
        JsonNode postData = field(player, "postDataPb", "post_data_pb");
        if (postData != null) {
            String deathType = text(field(postData, "deathType", "death_type"));
            if (deathType != null && !deathType.isEmpty()) {
                return PlayerStatus.fromDeathType(deathType);
            }
        }

        JsonNode telemetry = field(player, "telemetryPb", "telemetry_pb");
        if (telemetry != null && telemetry.isObject()) {
            JsonNode alive = field(telemetry, "isAlive", "is_alive");
            JsonNode groggy = field(telemetry, "isGroggy", "is_groggy");
            return PlayerStatus.fromTelemetry(
                    alive != null && alive.asBoolean(false),
                    groggy != null && groggy.asBoolean(false));
        }

        return PlayerStatus.ALIVE;
    }

    // === Helpers ===

    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static int intValue(JsonNode node) {
        return node == null ? 0 : node.asInt(0);
    }

    private static double doubleValue(JsonNode node) {
        return node == null ? 0 : node.asDouble(0);
    }

    /**
     * Numbers and numeric strings; anything else is 0 (unknown).
     */
    private static long numericId(JsonNode node) {
        if (node == null) {
            return 0;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    /**
     * Stable id for teams the producer sent without one.
     */
    static long idFromName(String name) {
        return Math.abs((long) name.hashCode());
    }
}
