package com.wifi.emitter.positioning.emitter;

import com.wifi.emitter.positioning.dto.RfIdentification;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recognizes WiFi networks that are likely to move: phone tethering defaults, in-vehicle access
 * points and public transport networks. Such emitters would drag learned coverage along their
 * route, so they are blacklisted.
 *
 * <p>Most checks work on whole words of the lower-cased label, which is much faster than substring
 * scans and only rarely misses a match.
 */
public final class MobileEmitterLabelFilter {

    private static final Pattern WORD_SPLIT = Pattern.compile("[^a-z]");

    private static final Set<String> WORDS =
            Set.of(
                    // mobile tethering
                    "android", "ipad", "phone", "motorola", "huawei", "iphone", "mobile",
                    // transport
                    "deinbus", "ecolines", "eurolines", "fernbus", "flixbus", "muenchenlinie", "postbus",
                    "skanetrafiken", "oresundstag", "regiojet",
                    // vehicles: "Chrysler uconnect xxxxxx", "Chevy Cruz 7774", "Bryces Silverado",
                    // "BMW98303 CarPlay"
                    "uconnect", "chevy", "silverado", "myvolvo", "bmw");

    private static final List<String> PREFIXES =
            List.of(
                    "moto ", "samsung galaxy", "lg aristo", "androidap",
                    // T-Mobile US portable cell based WiFi, Verizon hotspots
                    "cellspot", "verizon",
                    // GM default "WiFi Hotspot 1234", Mercedes "MB WLAN nnnnn"
                    "wifi hotspot ", "mb wlan ", "mb hotspot",
                    "westbahn ", "buswifi", "coachamerica", "disneylandresortexpress", "taxilinq",
                    "transitwirelesswifi",
                    // dashcam
                    "yicarcam",
                    "my seat", "vw wlan", "my vw", "my skoda", "skoda_wlan");

    private static final List<String> SUFFIXES =
            List.of(
                    // GM recommends "first_name vehicle_model", e.g. "Morgans Truck", "Laura Suburban"
                    "corvette", "truck", "suburban", "terrain", "sierra", "gmc wifi");

    private static final Set<String> EXACT =
            Set.of(
                    "amtrak", "amtrakconnect", "cdwifi", "megabus", "westlan", "wifi in de trein", "svciob",
                    "oebb", "oebb-postbus", "dpmbfree", "telekom_ice", "db ic bus", "gkbguest");

    private MobileEmitterLabelFilter() {}

    /**
     * Checks an emitter label against the known patterns of moving networks. Only WLAN labels are
     * tested; cell towers are not expected to move.
     *
     * @param identification emitter the label belongs to
     * @param label network name as broadcast
     * @return true if the emitter should be blacklisted
     */
    public static boolean isMobile(RfIdentification identification, String label) {
        if (label == null || label.isEmpty() || !identification.type().isWlan()) {
            return false;
        }
        String lc = label.toLowerCase(Locale.ROOT);
        List<String> words = Arrays.asList(WORD_SPLIT.split(lc, -1));
        Set<String> wordSet = words.stream().collect(Collectors.toSet());

        return wordSet.stream().anyMatch(WORDS::contains)
                || PREFIXES.stream().anyMatch(lc::startsWith)
                || SUFFIXES.stream().anyMatch(lc::endsWith)
                || EXACT.contains(lc)
                // "MOTO9564" and "MOTO9916" seen
                || (wordSet.contains("moto") && label.startsWith("MOTO"))
                || "audi".equals(words.get(0))
                || lc.equals(addressSuffix(identification.typeScopedId()))
                || (wordSet.contains("admin") && lc.contains("admin@ms"))
                || (wordSet.contains("guest") && lc.contains("guest@ms"))
                || (wordSet.contains("contiki") && lc.contains("contiki-wifi"))
                || (wordSet.contains("interakti") && lc.contains("nsb_interakti"))
                || (wordSet.contains("nvram") && lc.contains("nvram warning"));
    }

    // many cars default their SSID to the last three octets of the BSSID
    private static String addressSuffix(String address) {
        if (address.length() < 8) {
            return null;
        }
        return address.substring(address.length() - 8).toLowerCase(Locale.ROOT).replace(":", "");
    }
}
