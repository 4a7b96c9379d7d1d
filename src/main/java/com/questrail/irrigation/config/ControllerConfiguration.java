package com.questrail.irrigation.config;

import com.questrail.irrigation.zone.RainPolicy;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * ControllerConfiguration
 * =============================================================================
 * Typed, thread-safe configuration store shared by the scheduling engine and
 * the web layer.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>one {@link ZoneConfig} per zone (1-based), including the persisted ET accumulator</li>
 *   <li>one {@link MonthlySchedule} per calendar month</li>
 *   <li>{@link WeatherConfig}, {@link RainSensorConfig}, the daily zone cap and the local time zone</li>
 * </ul>
 *
 * <h2>Form binding</h2>
 * {@link #asMap()} flattens everything into {@code section-key} strings
 * ({@code zone1-enabled}, {@code schedule7-start}, {@code weather-station}, ...);
 * {@link #fromMap(Map)} applies such a map atomically: every entry is validated
 * first and nothing changes if any entry is invalid.
 *
 * <h2>Thread Safety</h2>
 * Reads take the read lock, mutations the write lock. Listeners run after the
 * lock is released.
 */
public final class ControllerConfiguration {

    public static final int DEFAULT_ZONE_COUNT = 6;

    private static final DateTimeFormatter START_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final Pattern INDEXED_KEY = Pattern.compile("(zone|schedule)(\\d+)-([a-z-]+)");
    private static final Pattern PLAIN_KEY = Pattern.compile("(weather|rainsensor|scheduler)-([a-z-]+)");

    private static final Set<String> ZONE_FIELDS = Set.of("name", "pin", "enabled", "rate", "current-et");
    private static final Set<String> SCHEDULE_FIELDS = Set.of("enabled", "start", "threshold", "zones-to-skip");
    private static final Set<String> WEATHER_FIELDS = Set.of(
            "enabled", "station", "latitude", "longitude", "crop-coefficient", "requests-per-minute");
    private static final Set<String> RAIN_FIELDS = Set.of("type", "pin", "precip", "policy");

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<ConfigurationListener> listeners = new CopyOnWriteArrayList<>();
    private final ZoneId timeZone;

    private ZoneConfig[] zones;
    private MonthlySchedule[] schedules;
    private WeatherConfig weather;
    private RainSensorConfig rainSensor;
    private int maxZonesPerDay;

    private ControllerConfiguration(Builder builder) {
        this.timeZone = builder.timeZone;
        this.zones = builder.zones.toArray(new ZoneConfig[0]);
        this.schedules = builder.schedules.clone();
        this.weather = builder.weather;
        this.rainSensor = builder.rainSensor;
        this.maxZonesPerDay = builder.maxZonesPerDay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ZoneId timeZone() {
        return timeZone;
    }

    public int zoneCount() {
        return read(() -> zones.length);
    }

    public ZoneConfig zone(int zone) {
        return read(() -> zones[zoneSlot(zone)]);
    }

    public List<ZoneConfig> zones() {
        return read(() -> List.of(zones));
    }

    public MonthlySchedule schedule(int month) {
        return read(() -> schedules[monthSlot(month)]);
    }

    public WeatherConfig weather() {
        return read(() -> weather);
    }

    public RainSensorConfig rainSensor() {
        return read(() -> rainSensor);
    }

    /**
     * Maximum number of zones the engine may start per block; {@code 0} = unlimited.
     */
    public int maxZonesPerDay() {
        return read(() -> maxZonesPerDay);
    }

    public double currentEt(int zone) {
        return zone(zone).currentEt();
    }

    public void setCurrentEt(int zone, double value) {
        modifyZone(zone, current -> current.withCurrentEt(value));
    }

    /**
     * Adds {@code delta} to a zone's demand under the write lock and returns
     * the new value.
     */
    public double addCurrentEt(int zone, double delta) {
        return modifyZone(zone, current -> current.withCurrentEt(current.currentEt() + delta)).currentEt();
    }

    public void updateZone(int zone, ZoneConfig config) {
        Objects.requireNonNull(config, "config");
        modifyZone(zone, current -> config);
    }

    private ZoneConfig modifyZone(int zone, UnaryOperator<ZoneConfig> change) {
        ZoneConfig updated;
        Set<String> changed;
        lock.writeLock().lock();
        try {
            int slot = zoneSlot(zone);
            Map<String, String> before = new LinkedHashMap<>();
            putZone(before, zone, zones[slot]);
            updated = Objects.requireNonNull(change.apply(zones[slot]), "config");
            zones[slot] = updated;
            Map<String, String> after = new LinkedHashMap<>();
            putZone(after, zone, updated);
            changed = diff(before, after);
        } finally {
            lock.writeLock().unlock();
        }
        notifyListeners(changed);
        return updated;
    }

    public void updateSchedule(int month, MonthlySchedule schedule) {
        Objects.requireNonNull(schedule, "schedule");
        Set<String> changed;
        lock.writeLock().lock();
        try {
            int slot = monthSlot(month);
            Map<String, String> before = new LinkedHashMap<>();
            putSchedule(before, month, schedules[slot]);
            schedules[slot] = schedule;
            Map<String, String> after = new LinkedHashMap<>();
            putSchedule(after, month, schedule);
            changed = diff(before, after);
        } finally {
            lock.writeLock().unlock();
        }
        notifyListeners(changed);
    }

    public void updateWeather(WeatherConfig config) {
        Objects.requireNonNull(config, "config");
        Set<String> changed;
        lock.writeLock().lock();
        try {
            Map<String, String> before = asMapLocked();
            weather = config;
            changed = diff(before, asMapLocked());
        } finally {
            lock.writeLock().unlock();
        }
        notifyListeners(changed);
    }

    public void updateRainSensor(RainSensorConfig config) {
        Objects.requireNonNull(config, "config");
        Set<String> changed;
        lock.writeLock().lock();
        try {
            Map<String, String> before = asMapLocked();
            rainSensor = config;
            changed = diff(before, asMapLocked());
        } finally {
            lock.writeLock().unlock();
        }
        notifyListeners(changed);
    }

    public void setMaxZonesPerDay(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("maxZonesPerDay must be >= 0");
        }
        Set<String> changed;
        lock.writeLock().lock();
        try {
            changed = maxZonesPerDay == value ? Set.of() : Set.of("scheduler-max-zones-per-day");
            maxZonesPerDay = value;
        } finally {
            lock.writeLock().unlock();
        }
        notifyListeners(changed);
    }

    public void addListener(ConfigurationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ConfigurationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Flattens the configuration into form keys, sorted by key.
     */
    public Map<String, String> asMap() {
        return read(this::asMapLocked);
    }

    /**
     * Applies a (possibly partial) form map.
     *
     * @throws IllegalArgumentException naming every invalid or unknown key; no
     *                                  value is applied in that case
     */
    public void fromMap(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        Set<String> changed;
        lock.writeLock().lock();
        try {
            Staging staging = new Staging();
            Map<String, String> errors = new TreeMap<>();
            for (Map.Entry<String, String> entry : values.entrySet()) {
                try {
                    staging.collect(entry.getKey(), entry.getValue());
                } catch (RuntimeException e) {
                    errors.put(entry.getKey(), e.getMessage());
                }
            }
            if (errors.isEmpty()) {
                staging.build(errors);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid configuration entries: " + errors);
            }
            Map<String, String> before = asMapLocked();
            staging.commit();
            changed = diff(before, asMapLocked());
        } finally {
            lock.writeLock().unlock();
        }
        notifyListeners(changed);
    }

    private Map<String, String> asMapLocked() {
        Map<String, String> out = new TreeMap<>();
        for (int i = 0; i < zones.length; i++) {
            putZone(out, i + 1, zones[i]);
        }
        for (int m = 0; m < schedules.length; m++) {
            putSchedule(out, m + 1, schedules[m]);
        }
        out.put("weather-enabled", onOff(weather.enabled()));
        out.put("weather-station", weather.stationId());
        out.put("weather-latitude", Double.toString(weather.latitude()));
        out.put("weather-longitude", Double.toString(weather.longitude()));
        out.put("weather-crop-coefficient", Double.toString(weather.cropCoefficient()));
        out.put("weather-requests-per-minute", Integer.toString(weather.requestsPerMinute()));
        out.put("rainsensor-type", rainSensor.type().formName());
        out.put("rainsensor-pin", Integer.toString(rainSensor.pin()));
        out.put("rainsensor-precip", Double.toString(rainSensor.precipCutoff()));
        out.put("rainsensor-policy", rainSensor.policy().name().toLowerCase(Locale.ROOT));
        out.put("scheduler-max-zones-per-day", Integer.toString(maxZonesPerDay));
        return out;
    }

    private static void putZone(Map<String, String> out, int zone, ZoneConfig config) {
        String p = "zone" + zone + "-";
        out.put(p + "name", config.name());
        out.put(p + "pin", Integer.toString(config.pin()));
        out.put(p + "enabled", onOff(config.enabled()));
        out.put(p + "rate", Double.toString(config.rateInchesPerHour()));
        out.put(p + "current-et", Double.toString(config.currentEt()));
    }

    private static void putSchedule(Map<String, String> out, int month, MonthlySchedule schedule) {
        String p = "schedule" + month + "-";
        out.put(p + "enabled", onOff(schedule.enabled()));
        out.put(p + "start", schedule.start().format(START_FORMAT));
        out.put(p + "threshold", Double.toString(schedule.threshold()));
        out.put(p + "zones-to-skip", schedule.zonesToSkip().stream()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(",")));
    }

    private static Set<String> diff(Map<String, String> before, Map<String, String> after) {
        Set<String> changed = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : after.entrySet()) {
            if (!Objects.equals(before.get(entry.getKey()), entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        return changed;
    }

    private void notifyListeners(Set<String> changed) {
        if (changed.isEmpty()) {
            return;
        }
        Set<String> keys = Set.copyOf(changed);
        for (ConfigurationListener listener : listeners) {
            listener.onConfigurationChanged(this, keys);
        }
    }

    private int zoneSlot(int zone) {
        if (zone < 1 || zone > zones.length) {
            throw new IllegalArgumentException("Unknown zone: " + zone);
        }
        return zone - 1;
    }

    private static int monthSlot(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be 1-12: " + month);
        }
        return month - 1;
    }

    private <T> T read(Supplier<T> supplier) {
        lock.readLock().lock();
        try {
            return supplier.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    static String onOff(boolean value) {
        return value ? "on" : "off";
    }

    static boolean parseOnOff(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "on", "true", "yes", "1" -> true;
            case "off", "false", "no", "0", "" -> false;
            default -> throw new IllegalArgumentException("expected on/off but was '" + value + "'");
        };
    }

    static Set<Integer> parseZoneList(String value) {
        Set<Integer> zonesToSkip = new TreeSet<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                zonesToSkip.add(Integer.parseInt(trimmed));
            }
        }
        return zonesToSkip;
    }

    /**
     * Working copy used by {@link #fromMap(Map)}. Entries are grouped per
     * record first so fields that are validated together (a hardware rain
     * sensor and its pin) can arrive in any order; committed only when every
     * record built.
     */
    private final class Staging {
        private final ZoneConfig[] stagedZones = zones.clone();
        private final MonthlySchedule[] stagedSchedules = schedules.clone();
        private WeatherConfig stagedWeather = weather;
        private RainSensorConfig stagedRain = rainSensor;
        private int stagedCap = maxZonesPerDay;

        private final Map<Integer, Map<String, String>> zoneFields = new TreeMap<>();
        private final Map<Integer, Map<String, String>> scheduleFields = new TreeMap<>();
        private final Map<String, String> weatherFields = new LinkedHashMap<>();
        private final Map<String, String> rainFields = new LinkedHashMap<>();

        /**
         * Sorts one entry into its record group; rejects unknown keys.
         */
        void collect(String key, String rawValue) {
            Objects.requireNonNull(key, "key");
            String value = rawValue == null ? "" : rawValue.trim();

            Matcher indexed = INDEXED_KEY.matcher(key);
            if (indexed.matches()) {
                int index = Integer.parseInt(indexed.group(2));
                String field = indexed.group(3);
                if (indexed.group(1).equals("zone")) {
                    zoneSlot(index);
                    requireField(field, ZONE_FIELDS);
                    zoneFields.computeIfAbsent(index, i -> new LinkedHashMap<>()).put(field, value);
                } else {
                    monthSlot(index);
                    requireField(field, SCHEDULE_FIELDS);
                    scheduleFields.computeIfAbsent(index, i -> new LinkedHashMap<>()).put(field, value);
                }
                return;
            }

            Matcher plain = PLAIN_KEY.matcher(key);
            if (!plain.matches()) {
                throw new IllegalArgumentException("unknown key");
            }
            String field = plain.group(2);
            switch (plain.group(1)) {
                case "weather" -> {
                    requireField(field, WEATHER_FIELDS);
                    weatherFields.put(field, value);
                }
                case "rainsensor" -> {
                    requireField(field, RAIN_FIELDS);
                    rainFields.put(field, value);
                }
                default -> {
                    if (!field.equals("max-zones-per-day")) {
                        throw new IllegalArgumentException("unknown key");
                    }
                    int cap = Integer.parseInt(value);
                    if (cap < 0) {
                        throw new IllegalArgumentException("must be >= 0");
                    }
                    stagedCap = cap;
                }
            }
        }

        /**
         * Builds every touched record, recording failures against the keys
         * that fed it.
         */
        void build(Map<String, String> errors) {
            for (Map.Entry<Integer, Map<String, String>> entry : zoneFields.entrySet()) {
                int zone = entry.getKey();
                attempt(errors, "zone" + zone + "-", entry.getValue(), () ->
                        stagedZones[zone - 1] = buildZone(stagedZones[zone - 1], entry.getValue()));
            }
            for (Map.Entry<Integer, Map<String, String>> entry : scheduleFields.entrySet()) {
                int month = entry.getKey();
                attempt(errors, "schedule" + month + "-", entry.getValue(), () ->
                        stagedSchedules[month - 1] = buildSchedule(stagedSchedules[month - 1], entry.getValue()));
            }
            if (!weatherFields.isEmpty()) {
                attempt(errors, "weather-", weatherFields, () -> stagedWeather = buildWeather(stagedWeather, weatherFields));
            }
            if (!rainFields.isEmpty()) {
                attempt(errors, "rainsensor-", rainFields, () -> stagedRain = buildRain(stagedRain, rainFields));
            }
        }

        void commit() {
            zones = stagedZones;
            schedules = stagedSchedules;
            weather = stagedWeather;
            rainSensor = stagedRain;
            maxZonesPerDay = stagedCap;
        }

        private void attempt(Map<String, String> errors, String prefix, Map<String, String> fields, Runnable build) {
            try {
                build.run();
            } catch (RuntimeException e) {
                for (String field : fields.keySet()) {
                    errors.put(prefix + field, e.getMessage());
                }
            }
        }

        private ZoneConfig buildZone(ZoneConfig z, Map<String, String> f) {
            return new ZoneConfig(
                    f.getOrDefault("name", z.name()),
                    f.containsKey("pin") ? parsePin(f.get("pin")) : z.pin(),
                    f.containsKey("enabled") ? parseOnOff(f.get("enabled")) : z.enabled(),
                    f.containsKey("rate") ? Double.parseDouble(f.get("rate")) : z.rateInchesPerHour(),
                    f.containsKey("current-et") ? Double.parseDouble(f.get("current-et")) : z.currentEt());
        }

        private MonthlySchedule buildSchedule(MonthlySchedule s, Map<String, String> f) {
            LocalTime start = s.start();
            if (f.containsKey("start")) {
                try {
                    start = LocalTime.parse(f.get("start"), START_FORMAT);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("expected HH:MM but was '" + f.get("start") + "'");
                }
            }
            return new MonthlySchedule(
                    f.containsKey("enabled") ? parseOnOff(f.get("enabled")) : s.enabled(),
                    start,
                    f.containsKey("threshold") ? Double.parseDouble(f.get("threshold")) : s.threshold(),
                    f.containsKey("zones-to-skip") ? parseZoneList(f.get("zones-to-skip")) : s.zonesToSkip());
        }

        private WeatherConfig buildWeather(WeatherConfig w, Map<String, String> f) {
            return new WeatherConfig(
                    f.containsKey("enabled") ? parseOnOff(f.get("enabled")) : w.enabled(),
                    f.getOrDefault("station", w.stationId()),
                    f.containsKey("latitude") ? Double.parseDouble(f.get("latitude")) : w.latitude(),
                    f.containsKey("longitude") ? Double.parseDouble(f.get("longitude")) : w.longitude(),
                    f.containsKey("crop-coefficient")
                            ? Double.parseDouble(f.get("crop-coefficient")) : w.cropCoefficient(),
                    f.containsKey("requests-per-minute")
                            ? Integer.parseInt(f.get("requests-per-minute")) : w.requestsPerMinute());
        }

        private RainSensorConfig buildRain(RainSensorConfig r, Map<String, String> f) {
            return new RainSensorConfig(
                    f.containsKey("type") ? RainSensorConfig.Type.parse(f.get("type")) : r.type(),
                    f.containsKey("pin") ? parsePin(f.get("pin")) : r.pin(),
                    f.containsKey("precip")
                            ? (f.get("precip").isEmpty() ? 0.0 : Double.parseDouble(f.get("precip")))
                            : r.precipCutoff(),
                    f.containsKey("policy")
                            ? RainPolicy.valueOf(f.get("policy").toUpperCase(Locale.ROOT)) : r.policy());
        }
    }

    private static void requireField(String field, Set<String> known) {
        if (!known.contains(field)) {
            throw new IllegalArgumentException("unknown key");
        }
    }

    private static int parsePin(String value) {
        return value.isEmpty() ? -1 : Integer.parseInt(value);
    }

    public static final class Builder {
        private final List<ZoneConfig> zones = new ArrayList<>();
        private final MonthlySchedule[] schedules = new MonthlySchedule[12];
        private WeatherConfig weather = WeatherConfig.disabled();
        private RainSensorConfig rainSensor = RainSensorConfig.off();
        private int maxZonesPerDay;
        private ZoneId timeZone = ZoneId.systemDefault();

        private Builder() {
            Arrays.fill(schedules, MonthlySchedule.disabled());
        }

        /**
         * Appends the next zone (zones are numbered in insertion order from 1).
         */
        public Builder addZone(ZoneConfig zone) {
            zones.add(Objects.requireNonNull(zone, "zone"));
            return this;
        }

        public Builder withSchedule(int month, MonthlySchedule schedule) {
            schedules[monthSlot(month)] = Objects.requireNonNull(schedule, "schedule");
            return this;
        }

        /**
         * Applies the same schedule to all twelve months.
         */
        public Builder withScheduleForAllMonths(MonthlySchedule schedule) {
            Objects.requireNonNull(schedule, "schedule");
            Arrays.fill(schedules, schedule);
            return this;
        }

        public Builder withWeather(WeatherConfig weather) {
            this.weather = Objects.requireNonNull(weather, "weather");
            return this;
        }

        public Builder withRainSensor(RainSensorConfig rainSensor) {
            this.rainSensor = Objects.requireNonNull(rainSensor, "rainSensor");
            return this;
        }

        public Builder withMaxZonesPerDay(int maxZonesPerDay) {
            if (maxZonesPerDay < 0) {
                throw new IllegalArgumentException("maxZonesPerDay must be >= 0");
            }
            this.maxZonesPerDay = maxZonesPerDay;
            return this;
        }

        public Builder withTimeZone(ZoneId timeZone) {
            this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
            return this;
        }

        /**
         * Builds the configuration; with no zones added, {@link #DEFAULT_ZONE_COUNT}
         * disabled zones are created.
         */
        public ControllerConfiguration build() {
            if (zones.isEmpty()) {
                for (int i = 1; i <= DEFAULT_ZONE_COUNT; i++) {
                    zones.add(ZoneConfig.disabled(i));
                }
            }
            return new ControllerConfiguration(this);
        }
    }
}
