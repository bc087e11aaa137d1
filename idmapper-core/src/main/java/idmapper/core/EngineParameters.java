/* 
 * Copyright (C) 2025 IDMAPPER developers
 *
 * This File is part of IDMAPPER
 *
 * IDMAPPER is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * IDMAPPER is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with IDMAPPER.  If not, see <http://www.gnu.org/licenses/>.
 */
package idmapper.core;

import idmapper.data_structure.Cast;
import idmapper.data_structure.Role;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tunable parameters of the identity engines and history
 */
public class EngineParameters {
    public final static String LOOKAHEAD = "stitch_lookahead";
    public final static String STITCH_TIME_GAP = "stitch_time_gap_seconds";
    public final static String STITCH_DISTANCE = "stitch_max_distance";
    public final static String NOISE_DISTANCE = "noise_max_distance";
    public final static String FPS = "fps";
    public final static String MAX_HISTORY = "max_history";
    public final static String RAM_BUFFER = "history_ram_buffer";

    public final static int DEFAULT_LOOKAHEAD = 15;
    public final static double DEFAULT_STITCH_TIME_GAP = 2.0;
    public final static double DEFAULT_STITCH_DISTANCE = 150;
    public final static double DEFAULT_NOISE_DISTANCE = 100;
    public final static double DEFAULT_FPS = 30;
    public final static int DEFAULT_MAX_HISTORY = 50;
    public final static int DEFAULT_RAM_BUFFER = 5;

    int lookahead = DEFAULT_LOOKAHEAD;
    double stitchTimeGapSeconds = DEFAULT_STITCH_TIME_GAP;
    double stitchMaxDistance = DEFAULT_STITCH_DISTANCE;
    double noiseMaxDistance = DEFAULT_NOISE_DISTANCE;
    double fps = DEFAULT_FPS;
    int maxHistory = DEFAULT_MAX_HISTORY;
    int ramBuffer = DEFAULT_RAM_BUFFER;

    /**
     * @return parameters read from {@link PropertyUtils}, defaults for missing keys
     */
    public static EngineParameters fromProperties() {
        return new EngineParameters()
                .setLookahead(PropertyUtils.get(LOOKAHEAD, DEFAULT_LOOKAHEAD))
                .setStitchTimeGapSeconds(PropertyUtils.get(STITCH_TIME_GAP, DEFAULT_STITCH_TIME_GAP))
                .setStitchMaxDistance(PropertyUtils.get(STITCH_DISTANCE, DEFAULT_STITCH_DISTANCE))
                .setNoiseMaxDistance(PropertyUtils.get(NOISE_DISTANCE, DEFAULT_NOISE_DISTANCE))
                .setFps(PropertyUtils.get(FPS, DEFAULT_FPS))
                .setMaxHistory(PropertyUtils.get(MAX_HISTORY, DEFAULT_MAX_HISTORY))
                .setRamBuffer(PropertyUtils.get(RAM_BUFFER, DEFAULT_RAM_BUFFER));
    }

    public void store() {
        PropertyUtils.set(LOOKAHEAD, lookahead);
        PropertyUtils.set(STITCH_TIME_GAP, stitchTimeGapSeconds);
        PropertyUtils.set(STITCH_DISTANCE, stitchMaxDistance);
        PropertyUtils.set(NOISE_DISTANCE, noiseMaxDistance);
        PropertyUtils.set(FPS, fps);
        PropertyUtils.set(MAX_HISTORY, maxHistory);
        PropertyUtils.set(RAM_BUFFER, ramBuffer);
    }

    /**
     * @return cast stored in {@link PropertyUtils}, or the default cast if none is stored
     */
    public static Cast castFromProperties() {
        List<String> names = PropertyUtils.getStrings(PropertyUtils.CAST);
        if (names.isEmpty()) return Cast.defaultCast();
        return new Cast(names.toArray(new String[0]));
    }

    public static void storeCast(Cast cast) {
        PropertyUtils.setStrings(PropertyUtils.CAST, cast.getRoles().stream().map(Role::getName).collect(Collectors.toList()));
    }

    public int getLookahead() {
        return lookahead;
    }

    public EngineParameters setLookahead(int lookahead) {
        if (lookahead < 1) throw new IllegalArgumentException("lookahead should be >= 1, was: "+lookahead);
        this.lookahead = lookahead;
        return this;
    }

    public double getStitchTimeGapSeconds() {
        return stitchTimeGapSeconds;
    }

    public EngineParameters setStitchTimeGapSeconds(double stitchTimeGapSeconds) {
        if (stitchTimeGapSeconds < 0) throw new IllegalArgumentException("time gap should be >= 0, was: "+stitchTimeGapSeconds);
        this.stitchTimeGapSeconds = stitchTimeGapSeconds;
        return this;
    }

    public double getStitchMaxDistance() {
        return stitchMaxDistance;
    }

    public EngineParameters setStitchMaxDistance(double stitchMaxDistance) {
        if (stitchMaxDistance < 0) throw new IllegalArgumentException("distance should be >= 0, was: "+stitchMaxDistance);
        this.stitchMaxDistance = stitchMaxDistance;
        return this;
    }

    public double getNoiseMaxDistance() {
        return noiseMaxDistance;
    }

    public EngineParameters setNoiseMaxDistance(double noiseMaxDistance) {
        if (noiseMaxDistance < 0) throw new IllegalArgumentException("distance should be >= 0, was: "+noiseMaxDistance);
        this.noiseMaxDistance = noiseMaxDistance;
        return this;
    }

    public double getFps() {
        return fps;
    }

    public EngineParameters setFps(double fps) {
        if (!(fps > 0)) throw new IllegalArgumentException("fps should be > 0, was: "+fps);
        this.fps = fps;
        return this;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public EngineParameters setMaxHistory(int maxHistory) {
        if (maxHistory < 1) throw new IllegalArgumentException("max history should be >= 1, was: "+maxHistory);
        this.maxHistory = maxHistory;
        return this;
    }

    public int getRamBuffer() {
        return ramBuffer;
    }

    public EngineParameters setRamBuffer(int ramBuffer) {
        if (ramBuffer < 1) throw new IllegalArgumentException("ram buffer should be >= 1, was: "+ramBuffer);
        this.ramBuffer = ramBuffer;
        return this;
    }

    @Override
    public String toString() {
        return "EngineParameters{lookahead="+lookahead+", stitchTimeGap="+stitchTimeGapSeconds+"s, stitchDistance="+stitchMaxDistance
                +", noiseDistance="+noiseMaxDistance+", fps="+fps+", maxHistory="+maxHistory+", ramBuffer="+ramBuffer+"}";
    }
}
