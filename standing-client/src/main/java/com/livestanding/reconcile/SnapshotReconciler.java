package com.livestanding.reconcile;

import com.livestanding.snapshot.MatchSnapshot;
import com.livestanding.snapshot.PlayerRecord;
import com.livestanding.snapshot.PlayerStatus;
import com.livestanding.snapshot.TeamRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diffs a snapshot against the panels already on screen.
 *
 * For each of the top N roster teams (rank, then name) that also plays the
 * current match, in order:
 * 1. create a panel if there is none, at the next display slot
 * 2. recompute its squad from the current-match players (by team id, else by name)
 * 3. report a rank change against the rank seen on the previous pass
 * 4. report "just eliminated" once, when every player of an in-match team is down;
 *    the mark is kept while the producer still flags the team eliminated
 *
 * A just-eliminated team finishing 2nd ends the match: the elimination batch
 * for that pass is suppressed, other updates still go out.
 *
 * Stateless apart from the {@link PanelRegistry} passed in, which the caller
 * owns. Passes over the same registry must not overlap.
 */
public class SnapshotReconciler {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotReconciler.class);

    static final int RUNNER_UP_PLACEMENT = 2;

    private static final Comparator<TeamRecord> STANDINGS_ORDER =
            Comparator.comparingInt(TeamRecord::getRank).thenComparing(TeamRecord::getName);

    private static final Comparator<EliminationEvent> WORST_PLACEMENT_FIRST =
            Comparator.comparingInt(EliminationEvent::getPlacementRank).reversed();

    private final int maxDisplayedTeams;
    private final int minSquadSize;

    public SnapshotReconciler(int maxDisplayedTeams, int minSquadSize) {
        if (maxDisplayedTeams <= 0) {
            throw new IllegalArgumentException("maxDisplayedTeams must be positive: " + maxDisplayedTeams);
        }
        this.maxDisplayedTeams = maxDisplayedTeams;
        this.minSquadSize = minSquadSize;
    }

    /**
     * @param refresh a new match (or a producer-requested rebuild); the registry is
     *                cleared first and no rank changes are reported
     */
    public ReconcileResult reconcile(MatchSnapshot snapshot, PanelRegistry registry, boolean refresh) {
        if (refresh) {
            registry.clear();
            logger.info("Full rebuild for match {}", snapshot.matchIdHex());
        }

        List<TeamRecord> displayed = displayedTeams(snapshot.getRoster());
        Map<String, TeamRecord> matchTeams = new LinkedHashMap<>();
        for (TeamRecord team : snapshot.getTeams()) {
            matchTeams.putIfAbsent(team.getName(), team);
        }
        PlayerIndex players = new PlayerIndex(snapshot.getPlayers());

        List<TeamUpsert> upserts = new ArrayList<>();
        List<RankChangeEvent> rankChanges = new ArrayList<>();
        List<EliminationEvent> eliminations = new ArrayList<>();
        boolean matchEnded = false;
        int displayIndex = 1;

        for (TeamRecord team : displayed) {
            TeamRecord matchTeam = matchTeams.get(team.getName());
            if (matchTeam == null) {
                // Not playing this match, no panel
                continue;
            }

            TeamPanel panel = registry.get(team.getName());
            boolean created = panel == null;
            if (created) {
                panel = registry.create(team, displayIndex);
                logger.debug("Panel created for {} at slot {}", team.getName(), displayIndex);
            }

            List<PlayerRecord> teamPlayers = players.of(team);
            boolean inMatch = !teamPlayers.isEmpty();
            boolean allDown = inMatch && teamPlayers.stream().allMatch(p -> p.getStatus() != PlayerStatus.ALIVE);

            if (!created && !refresh && panel.getPreviousRank() > 0 && panel.getPreviousRank() != team.getRank()) {
                RankChangeEvent change = new RankChangeEvent(team.getId(), team.getName(), panel.getPreviousRank(), team.getRank());
                rankChanges.add(change);
                logger.debug("Rank {} for {}: {} -> {}", change.getDirection(), team.getName(),
                        change.getFromRank(), change.getToRank());
            }

            boolean justEliminated = false;
            if (allDown && !panel.isEliminated()) {
                panel.setEliminated(true);
                justEliminated = true;
                logger.info("Team {} eliminated (placement {})", team.getName(), matchTeam.getPlacementRank());
            } else if (!allDown && panel.isEliminated() && !matchTeam.isEliminated()) {
                // Someone is back up and the producer agrees; a later wipe counts again
                panel.setEliminated(false);
            }

            if (justEliminated && !matchEnded) {
                if (matchTeam.getPlacementRank() == RUNNER_UP_PLACEMENT) {
                    matchEnded = true;
                    logger.info("Match ended, runner-up {} eliminated", team.getName());
                }
                eliminations.add(new EliminationEvent(team.getId(), team.getName(),
                        matchTeam.getPlacementRank(), team.getRank()));
            }

            int killDelta = created ? 0 : matchTeam.getTotalKills() - panel.getPreviousKills();
            SquadStatus squad = SquadStatus.of(teamPlayers, minSquadSize);
            panel.update(team, squad, displayIndex, matchTeam.getTotalKills(), inMatch);

            upserts.add(TeamUpsert.builder()
                    .teamId(team.getId())
                    .teamName(team.getName())
                    .displayIndex(displayIndex)
                    .rank(team.getRank())
                    .totalScore(team.getTotalScore())
                    .matchKills(matchTeam.getTotalKills())
                    .killDelta(killDelta)
                    .squad(squad)
                    .inMatch(inMatch)
                    .eliminated(panel.isEliminated())
                    .justEliminated(justEliminated)
                    .created(created)
                    .build());

            displayIndex++;
        }

        if (matchEnded) {
            eliminations.clear();
        } else {
            eliminations.sort(WORST_PLACEMENT_FIRST);
        }

        boolean snap = refresh;
        if (!displayed.isEmpty() && !registry.isSnappedAtFullSize() && registry.size() == displayed.size()) {
            registry.markSnappedAtFullSize();
            snap = true;
        }

        ReconcileResult result = new ReconcileResult(refresh, upserts, rankChanges, eliminations, matchEnded, snap);
        logger.debug("Reconciled {}", result);
        return result;
    }

    private List<TeamRecord> displayedTeams(List<TeamRecord> roster) {
        List<TeamRecord> sorted = new ArrayList<>(roster);
        sorted.sort(STANDINGS_ORDER);
        return sorted.size() > maxDisplayedTeams ? sorted.subList(0, maxDisplayedTeams) : sorted;
    }

    /**
     * Current-match players grouped by team id and by team name.
     */
    private static class PlayerIndex {

        private final Map<Long, List<PlayerRecord>> byId = new HashMap<>();
        private final Map<String, List<PlayerRecord>> byName = new HashMap<>();

        PlayerIndex(List<PlayerRecord> players) {
            for (PlayerRecord player : players) {
                if (player.getTeamId() != 0) {
                    byId.computeIfAbsent(player.getTeamId(), id -> new ArrayList<>()).add(player);
                }
                if (player.getTeamName() != null) {
                    byName.computeIfAbsent(player.getTeamName(), name -> new ArrayList<>()).add(player);
                }
            }
        }

        List<PlayerRecord> of(TeamRecord team) {
            List<PlayerRecord> matched = byId.get(team.getId());
            if (matched == null || matched.isEmpty()) {
                matched = byName.getOrDefault(team.getName(), List.of());
            }
            return matched;
        }
    }
}
