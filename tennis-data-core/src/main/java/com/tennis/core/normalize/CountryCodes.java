package com.tennis.core.normalize;

import com.tennis.core.model.Player;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Country name and IOC code lookups resolving to ISO 3166-1 alpha-2 codes.
 */
public final class CountryCodes {

    private static final Pattern ISO2 = Pattern.compile("^[A-Z]{2}$");

    /**
     * Flag emoji (regional indicators, white/black flags, joiners), the question-mark
     * ornament and the replacement character.
     */
    static final Pattern FLAG_ARTIFACTS = Pattern.compile(
            "[\\x{1F1E6}-\\x{1F1FF}\\x{1F3F3}\\x{1F3F4}\\x{1F6A9}\\x{1F308}\\x{FE0F}\\x{200D}\\x{2753}\\x{FFFD}]");

    private static final Set<String> INVALID_CODES = Set.of("Neutral", "neutral", "N/A", "n/a", "XX", "");

    private static final Map<String, String> NAME_TO_CODE = Map.ofEntries(
            Map.entry("Great Britain", "GB"),
            Map.entry("United Kingdom", "GB"),
            Map.entry("England", "GB"),
            Map.entry("Scotland", "GB"),
            Map.entry("Wales", "GB"),
            Map.entry("United States", "US"),
            Map.entry("USA", "US"),
            Map.entry("America", "US"),
            Map.entry("Czechia", "CZ"),
            Map.entry("Czech Republic", "CZ"),
            Map.entry("Russia", "RU"),
            Map.entry("Russian Federation", "RU"),
            Map.entry("Korea", "KR"),
            Map.entry("South Korea", "KR"),
            Map.entry("Taiwan", "TW"),
            Map.entry("Chinese Taipei", "TW"),
            Map.entry("Qatar", "QA"),
            Map.entry("Switzerland", "CH"),
            Map.entry("Australia", "AU"),
            Map.entry("India", "IN"),
            Map.entry("New Zealand", "NZ"),
            Map.entry("Croatia", "HR"),
            Map.entry("France", "FR"),
            Map.entry("UAE", "AE"),
            Map.entry("United Arab Emirates", "AE"),
            Map.entry("Netherlands", "NL"),
            Map.entry("Mexico", "MX"),
            Map.entry("Argentina", "AR"),
            Map.entry("Morocco", "MA"),
            Map.entry("Spain", "ES"),
            Map.entry("Germany", "DE"),
            Map.entry("Italy", "IT"),
            Map.entry("Sweden", "SE"),
            Map.entry("Canada", "CA"),
            Map.entry("Romania", "RO"),
            Map.entry("China", "CN"),
            Map.entry("Japan", "JP"),
            Map.entry("Monaco", "MC"),
            Map.entry("Austria", "AT"),
            Map.entry("Serbia", "RS"),
            Map.entry("Malaysia", "MY"),
            Map.entry("Brazil", "BR"),
            Map.entry("Colombia", "CO"),
            Map.entry("Turkey", "TR"),
            Map.entry("Ecuador", "EC"),
            Map.entry("Portugal", "PT"),
            Map.entry("Bulgaria", "BG"),
            Map.entry("Chile", "CL"),
            Map.entry("Poland", "PL"),
            Map.entry("Kazakhstan", "KZ"),
            Map.entry("Tunisia", "TN"),
            Map.entry("Belgium", "BE"),
            Map.entry("Hungary", "HU"),
            Map.entry("Slovakia", "SK"),
            Map.entry("Slovenia", "SI"),
            Map.entry("Finland", "FI"),
            Map.entry("Greece", "GR"),
            Map.entry("Norway", "NO"),
            Map.entry("Denmark", "DK"),
            Map.entry("Israel", "IL"),
            Map.entry("Thailand", "TH"),
            Map.entry("Indonesia", "ID"),
            Map.entry("Philippines", "PH"),
            Map.entry("Vietnam", "VN"),
            Map.entry("Singapore", "SG"),
            Map.entry("Hong Kong", "HK"),
            Map.entry("Ukraine", "UA"),
            Map.entry("Belarus", "BY"),
            Map.entry("Lithuania", "LT"),
            Map.entry("Latvia", "LV"),
            Map.entry("Estonia", "EE"),
            Map.entry("Moldova", "MD"),
            Map.entry("Georgia", "GE"),
            Map.entry("Armenia", "AM"),
            Map.entry("Uzbekistan", "UZ"),
            Map.entry("Cyprus", "CY"),
            Map.entry("Ireland", "IE"),
            Map.entry("Uruguay", "UY"),
            Map.entry("Paraguay", "PY"),
            Map.entry("Venezuela", "VE"),
            Map.entry("Peru", "PE"),
            Map.entry("Bolivia", "BO"),
            Map.entry("South Africa", "ZA"),
            Map.entry("Egypt", "EG"),
            Map.entry("Bosnia and Herzegovina", "BA"),
            Map.entry("Montenegro", "ME")
    );

    private static final Map<String, String> IOC_TO_ISO2 = Map.ofEntries(
            Map.entry("USA", "US"), Map.entry("GBR", "GB"), Map.entry("GER", "DE"), Map.entry("DEU", "DE"),
            Map.entry("ESP", "ES"), Map.entry("FRA", "FR"), Map.entry("ITA", "IT"), Map.entry("AUS", "AU"),
            Map.entry("CAN", "CA"), Map.entry("RUS", "RU"), Map.entry("JPN", "JP"), Map.entry("CHN", "CN"),
            Map.entry("IND", "IN"), Map.entry("BRA", "BR"), Map.entry("ARG", "AR"), Map.entry("MEX", "MX"),
            Map.entry("SUI", "CH"), Map.entry("CHE", "CH"), Map.entry("NED", "NL"), Map.entry("NLD", "NL"),
            Map.entry("BEL", "BE"), Map.entry("SWE", "SE"), Map.entry("NOR", "NO"), Map.entry("DEN", "DK"),
            Map.entry("DNK", "DK"), Map.entry("FIN", "FI"), Map.entry("AUT", "AT"), Map.entry("CZE", "CZ"),
            Map.entry("POL", "PL"), Map.entry("HUN", "HU"), Map.entry("CRO", "HR"), Map.entry("HRV", "HR"),
            Map.entry("SRB", "RS"), Map.entry("SVK", "SK"), Map.entry("SLO", "SI"), Map.entry("SVN", "SI"),
            Map.entry("UKR", "UA"), Map.entry("ROU", "RO"), Map.entry("BUL", "BG"), Map.entry("BGR", "BG"),
            Map.entry("GRE", "GR"), Map.entry("GRC", "GR"), Map.entry("POR", "PT"), Map.entry("PRT", "PT"),
            Map.entry("ISR", "IL"), Map.entry("EGY", "EG"), Map.entry("RSA", "ZA"), Map.entry("ZAF", "ZA"),
            Map.entry("KOR", "KR"), Map.entry("TPE", "TW"), Map.entry("TWN", "TW"), Map.entry("THA", "TH"),
            Map.entry("INA", "ID"), Map.entry("IDN", "ID"), Map.entry("MAS", "MY"), Map.entry("MYS", "MY"),
            Map.entry("SGP", "SG"), Map.entry("PHI", "PH"), Map.entry("PHL", "PH"), Map.entry("VIE", "VN"),
            Map.entry("VNM", "VN"), Map.entry("UAE", "AE"), Map.entry("QAT", "QA"), Map.entry("KUW", "KW"),
            Map.entry("LIB", "LB"), Map.entry("TUN", "TN"), Map.entry("MAR", "MA"), Map.entry("ALG", "DZ"),
            Map.entry("NGR", "NG"), Map.entry("ZIM", "ZW"), Map.entry("KEN", "KE"), Map.entry("ETH", "ET"),
            Map.entry("GHA", "GH"), Map.entry("CIV", "CI"), Map.entry("SEN", "SN"), Map.entry("CAM", "CM"),
            Map.entry("ANG", "AO"), Map.entry("COL", "CO"), Map.entry("CHI", "CL"), Map.entry("CHL", "CL"),
            Map.entry("ECU", "EC"), Map.entry("PER", "PE"), Map.entry("URU", "UY"), Map.entry("URY", "UY"),
            Map.entry("PAR", "PY"), Map.entry("PRY", "PY"), Map.entry("VEN", "VE"), Map.entry("BOL", "BO"),
            Map.entry("KAZ", "KZ"), Map.entry("TUR", "TR"), Map.entry("LTU", "LT"), Map.entry("LAT", "LV"),
            Map.entry("LVA", "LV"), Map.entry("EST", "EE"), Map.entry("IRL", "IE"), Map.entry("ISL", "IS"),
            Map.entry("MLT", "MT"), Map.entry("CYP", "CY"), Map.entry("LUX", "LU"), Map.entry("MON", "MC"),
            Map.entry("MCO", "MC"), Map.entry("NZL", "NZ"), Map.entry("HKG", "HK"), Map.entry("BIH", "BA"),
            Map.entry("MNE", "ME"), Map.entry("MDA", "MD"), Map.entry("GEO", "GE"), Map.entry("ARM", "AM"),
            Map.entry("BLR", "BY"), Map.entry("UZB", "UZ"), Map.entry("ENG", "GB"), Map.entry("SCO", "GB"),
            Map.entry("WAL", "GB"), Map.entry("NIR", "GB")
    );

    private CountryCodes() {
    }

    /**
     * True for exactly two uppercase ASCII letters.
     */
    public static boolean isCanonical(String code) {
        return code != null && ISO2.matcher(code).matches();
    }

    public static boolean containsFlagArtifact(String value) {
        return value != null && FLAG_ARTIFACTS.matcher(value).find();
    }

    /**
     * Values feeds use in place of a real code, including any flag emoji.
     */
    public static boolean isInvalidSentinel(String code) {
        return code == null || INVALID_CODES.contains(code.trim()) || containsFlagArtifact(code);
    }

    public static Optional<String> fromCountryName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(NAME_TO_CODE.get(name.trim()));
    }

    /**
     * Maps an IOC or ISO-3 code to ISO-2. Two-letter codes pass through; anything
     * unresolvable becomes the unknown sentinel.
     */
    public static String fromIoc(String ioc) {
        if (ioc == null || ioc.isBlank()) return Player.UNKNOWN_COUNTRY_CODE;
        String upper = ioc.trim().toUpperCase();
        if (isCanonical(upper)) return upper;
        return IOC_TO_ISO2.getOrDefault(upper, Player.UNKNOWN_COUNTRY_CODE);
    }
}
