/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.massrecal.core;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;

import java.util.Map;

/**
 * Per-element count ranges used for formula generation. Immutable, one instance per call.
 */
public final class ElementBounds {

    public static final String DEFAULT = "C:4-30,H:4-60,O:0-20";

    private final ImmutableMap<String, ImmutablePair<Integer, Integer>> bounds;

    private ElementBounds(ImmutableMap<String, ImmutablePair<Integer, Integer>> bounds) {
        this.bounds = bounds;
    }

    public static ElementBounds defaults() {
        return parse(DEFAULT);
    }

    public static ElementBounds of(Map<String, ImmutablePair<Integer, Integer>> bounds) {
        ImmutableMap.Builder<String, ImmutablePair<Integer, Integer>> b = ImmutableMap.builder();
        for (Map.Entry<String, ImmutablePair<Integer, Integer>> e : bounds.entrySet()) {
            MassTools.elementIndex(e.getKey());
            int lo = e.getValue().getLeft();
            int hi = e.getValue().getRight();
            if (lo < 0 || hi < lo)
                throw new IllegalArgumentException("Invalid range for element " + e.getKey() + ": " + lo + "-" + hi);
            b.put(e.getKey(), ImmutablePair.of(lo, hi));
        }
        return new ElementBounds(b.build());
    }

    /**
     * Parses strings of the form "C:4-30,H:4-60,O:0-20".
     */
    public static ElementBounds parse(String s) {
        if (StringUtils.isBlank(s))
            throw new IllegalArgumentException("Empty element bounds");
        ImmutableMap.Builder<String, ImmutablePair<Integer, Integer>> b = ImmutableMap.builder();
        for (String tok : s.split(",")) {
            String[] sp = tok.trim().split(":");
            if (sp.length != 2)
                throw new IllegalArgumentException("Malformed element bound: " + tok);
            String[] range = sp[1].trim().split("-");
            if (range.length != 2)
                throw new IllegalArgumentException("Malformed element range: " + tok);
            b.put(sp[0].trim(), ImmutablePair.of(Integer.parseInt(range[0].trim()), Integer.parseInt(range[1].trim())));
        }
        return of(b.build());
    }

    public int getMin(String element) {
        ImmutablePair<Integer, Integer> p = bounds.get(element);
        return p == null ? 0 : p.getLeft();
    }

    public int getMax(String element) {
        ImmutablePair<Integer, Integer> p = bounds.get(element);
        return p == null ? 0 : p.getRight();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ImmutablePair<Integer, Integer>> e : bounds.entrySet()) {
            if (sb.length() > 0)
                sb.append(",");
            sb.append(e.getKey()).append(":").append(e.getValue().getLeft()).append("-").append(e.getValue().getRight());
        }
        return sb.toString();
    }
}
