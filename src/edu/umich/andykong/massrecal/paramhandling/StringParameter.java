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

package edu.umich.andykong.massrecal.paramhandling;

import java.util.Arrays;
import java.util.List;

/**
 * Free text, or one of a fixed set of choices when choices are given.
 */
public class StringParameter implements Parameter<String> {
    private final String key;
    private String value;
    private final String defaultValue;
    private final List<String> choices;
    private final String description;

    public StringParameter(String key, String value, String description, String... choices) {
        this.key = key;
        this.description = description;
        this.choices = Arrays.asList(choices);
        this.defaultValue = value;
        setValue(value);
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public String getDefaultValue() {
        return defaultValue;
    }

    @Override
    public void setValue(String value) throws IllegalArgumentException {
        if (!isValid(value))
            throw new IllegalArgumentException(String.format("%s must be one of %s, got [%s]", key, choices, value));
        this.value = value;
    }

    @Override
    public void parseValue(String value) throws IllegalArgumentException {
        setValue(value.trim());
    }

    @Override
    public boolean isValid(String value) {
        if (value == null)
            return false;
        return choices.isEmpty() || choices.contains(value);
    }
}
