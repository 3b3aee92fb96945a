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


public class IntegerParameter implements Parameter<Integer> {
    private final String key;
    private int value;
    private final int min;
    private final int max;
    private final int defaultValue;
    private final String description;

    public IntegerParameter(String key, int min, int max, int value, String description) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.value = value;
        this.defaultValue = value;
        this.description = description;
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
    public Integer getValue() {
        return value;
    }

    @Override
    public Integer getDefaultValue() {
        return defaultValue;
    }

    @Override
    public void setValue(Integer value) throws IllegalArgumentException {
        if (!isValid(value)) {
            throw new IllegalArgumentException(String.format(this.key + " received an invalid argument: %s", value));
        }
        this.value = value;
    }

    @Override
    public void parseValue(String value) throws IllegalArgumentException {
        try {
            setValue(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " received a non-integer argument: " + value, e);
        }
    }

    @Override
    public boolean isValid(Integer value) {
        return value != null && ((value >= min) && (value <= max));
    }


}
