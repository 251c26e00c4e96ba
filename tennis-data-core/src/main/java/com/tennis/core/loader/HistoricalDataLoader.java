package com.tennis.core.loader;

import com.tennis.core.cache.CacheStats;
import com.tennis.core.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads the historical archive of one tour from a data directory:
 * {@code <tour>_players.csv}, {@code <tour>_rankings_current.csv},
 * {@code <tour>_rankings_<year>.csv} and {@code <tour>_matches_<year>.csv}.
 * <p>
 * Parsed files are cached per loader instance. Missing or unreadable files come back as
 * empty lists; callers treat empty as "no data".
 */
public class HistoricalDataLoader {

    private static final Logger log = LoggerFactory.getLogger(HistoricalDataLoader.class);

    private final Path dataDir;
    private final String tour;
    private final DelimitedTextParser parser = DelimitedTextParser.csv();
    private final Pattern rankingFilePattern;
    private final Pattern matchFilePattern;

    private final TtlCache<String, List<PlayerRecord>> playerCache;
    private final TtlCache<String, List<RankingRecord>> rankingCache;
    private final TtlCache<Integer, List<HistoricalMatchRecord>> matchCache;

    public HistoricalDataLoader(Path dataDir, String tour, Duration cacheTtl, Clock clock) {
        this.dataDir = dataDir;
        this.tour = tour;
        this.rankingFilePattern = Pattern.compile("^" + Pattern.quote(tour) + "_rankings_(\\d{4})\\.csv$");
        this.matchFilePattern = Pattern.compile("^" + Pattern.quote(tour) + "_matches_(\\d{4})\\.csv$");
        this.playerCache = new TtlCache<>(cacheTtl, clock);
        this.rankingCache = new TtlCache<>(cacheTtl, clock);
        this.matchCache = new TtlCache<>(cacheTtl, clock);
    }

    public HistoricalDataLoader(Path dataDir, String tour, Duration cacheTtl) {
        this(dataDir, tour, cacheTtl, Clock.systemUTC());
    }

    public Path getDataDir() {
        return dataDir;
    }

    public String getTour() {
        return tour;
    }

    // ============ PLAYERS ============

    public List<PlayerRecord> loadPlayers() {
        return playerCache.getOrCompute("players", () -> {
            try {
                List<PlayerRecord> players = readRequired(fileName("players"), PlayerRecord::from);
                log.info("Loaded {} players from {}", players.size(), fileName("players"));
                return players;
            } catch (IOException e) {
                log.error("Error reading player registry {}: {}", fileName("players"), e.getMessage());
                return List.of();
            }
        });
    }

    /**
     * Registry keyed by player id, in file order.
     */
    public Map<String, PlayerRecord> playerRegistry() {
        Map<String, PlayerRecord> registry = new LinkedHashMap<>();
        for (PlayerRecord player : loadPlayers()) {
            if (player.playerId() != null) {
                registry.putIfAbsent(player.playerId(), player);
            }
        }
        return registry;
    }

    public Optional<PlayerRecord> findPlayer(String playerId) {
        if (playerId == null) return Optional.empty();
        return loadPlayers().stream()
                .filter(p -> playerId.equals(p.playerId()))
                .findFirst();
    }

    // ============ RANKINGS ============

    /**
     * Current snapshot file. A missing file is a read failure at this level, logged and
     * reported as no rankings.
     */
    public List<RankingRecord> loadCurrentRankings() {
        return rankingCache.getOrCompute("current", () -> {
            try {
                List<RankingRecord> rankings = readRequired(fileName("rankings_current"), RankingRecord::from);
                log.info("Loaded {} current ranking rows", rankings.size());
                return rankings;
            } catch (IOException e) {
                log.error("Error loading current rankings from {}: {}", fileName("rankings_current"), e.getMessage());
                return List.of();
            }
        });
    }

    /**
     * Year file when present; otherwise the current file if its latest snapshot falls in
     * that year.
     */
    public List<RankingRecord> loadRankingsForYear(int year) {
        return rankingCache.getOrCompute(String.valueOf(year), () -> {
            String file = fileName("rankings_" + year);
            if (Files.exists(dataDir.resolve(file))) {
                return readOptional(file, RankingRecord::from);
            }

            List<RankingRecord> current = loadCurrentRankings();
            Integer currentYear = RankingDates.yearOf(RankingDates.latestRankingDate(current));
            if (currentYear != null && currentYear == year) {
                log.debug("No {} for {}, using current rankings", file, year);
                return current;
            }

            log.warn("Rankings file not found for year {}: {}", year, file);
            return List.of();
        });
    }

    public List<RankingRecord> loadRankingsForYears(Collection<Integer> years) {
        List<RankingRecord> all = new ArrayList<>();
        for (Integer year : years) {
            all.addAll(loadRankingsForYear(year));
        }
        return all;
    }

    /**
     * Years with a ranking file plus the year of the current snapshot, most recent first.
     */
    public List<Integer> availableRankingYears() {
        TreeSet<Integer> years = new TreeSet<>(Comparator.reverseOrder());
        try {
            years.addAll(yearsMatching(rankingFilePattern));
        } catch (IOException e) {
            log.error("Error listing ranking files in {}: {}", dataDir, e.getMessage());
            return List.of();
        }

        if (Files.exists(dataDir.resolve(fileName("rankings_current")))) {
            Integer currentYear = RankingDates.yearOf(RankingDates.latestRankingDate(loadCurrentRankings()));
            if (currentYear != null) years.add(currentYear);
        }
        return new ArrayList<>(years);
    }

    // ============ MATCHES ============

    public List<HistoricalMatchRecord> loadMatches(int year) {
        return matchCache.getOrCompute(year, () -> {
            String file = fileName("matches_" + year);
            if (!Files.exists(dataDir.resolve(file))) {
                log.warn("Matches file not found for year {}: {}", year, file);
                return List.of();
            }
            List<HistoricalMatchRecord> matches = readOptional(file, HistoricalMatchRecord::from);
            log.info("Loaded {} matches for {}", matches.size(), year);
            return matches;
        });
    }

    public List<HistoricalMatchRecord> loadMatches(Collection<Integer> years) {
        List<HistoricalMatchRecord> all = new ArrayList<>();
        for (Integer year : years) {
            all.addAll(loadMatches(year));
        }
        return all;
    }

    public List<Integer> availableMatchYears() {
        try {
            return yearsMatching(matchFilePattern).stream()
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (IOException e) {
            log.error("Error listing match files in {}: {}", dataDir, e.getMessage());
            return List.of();
        }
    }

    // ============ CACHE ============

    public void clearCache() {
        playerCache.clear();
        rankingCache.clear();
        matchCache.clear();
        log.info("Historical data cache cleared");
    }

    public Map<String, CacheStats> cacheStats() {
        Map<String, CacheStats> stats = new LinkedHashMap<>();
        stats.put("players", playerCache.stats());
        stats.put("rankings", rankingCache.stats());
        stats.put("matches", matchCache.stats());
        return stats;
    }

    // ============ HELPERS ============

    private String fileName(String suffix) {
        return tour + "_" + suffix + ".csv";
    }

    private <T> List<T> readRequired(String file, Function<Map<String, String>, T> mapper) throws IOException {
        try (Reader reader = Files.newBufferedReader(dataDir.resolve(file), StandardCharsets.UTF_8)) {
            return parser.parse(reader).stream()
                    .map(mapper)
                    .filter(Objects::nonNull)
                    .toList();
        }
    }

    private <T> List<T> readOptional(String file, Function<Map<String, String>, T> mapper) {
        try {
            return readRequired(file, mapper);
        } catch (IOException e) {
            log.error("Error reading {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private List<Integer> yearsMatching(Pattern pattern) throws IOException {
        List<Integer> years = new ArrayList<>();
        try (Stream<Path> files = Files.list(dataDir)) {
            files.forEach(path -> {
                Matcher m = pattern.matcher(path.getFileName().toString());
                if (m.matches()) years.add(Integer.parseInt(m.group(1)));
            });
        }
        return years;
    }
}
