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

import java.util.LinkedHashMap;
import java.util.Map;

public class Metadata {
	private final LinkedHashMap<String, String> entries;

	public Metadata() {
		this.entries = new LinkedHashMap<>();
	}

	public void add(Map<String, String> values) {
		entries.putAll(values);
	}

	public void put(String key, String value) {
		entries.put(key, value);
	}

	public String get(String key) {
		return entries.get(key);
	}

	public boolean containsKey(String key) {
		return entries.containsKey(key);
	}

	public Map<String, String> asMap() {
		return new LinkedHashMap<>(entries);
	}

	public Metadata copy() {
		Metadata m = new Metadata();
		m.entries.putAll(this.entries);
		return m;
	}
}
