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


public class DoubleParameter implements Parameter<Double> {
    private final String key;
    private double value;
    private final double defaultValue;
    private final double min;
    private final double max;
    private final String description;

    public DoubleParameter(String key, double min, double max, double value, String description) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.description = description;
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
    public Double getValue() {
        return this.value;
    }

    @Override
    public Double getDefaultValue() {
        return defaultValue;
    }

    @Override
    public void setValue(Double value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException(String.format("%s value %s out of bounds [%s, %s]", key, value, min, max));
        }
        this.value = value;
    }

    @Override
    public void parseValue(String value) {
        try {
            setValue(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " received a non-numeric argument: " + value, e);
        }
    }

    @Override
    public boolean isValid(Double value) {
        return value != null && ((value >= this.min) && (value <= this.max));
    }
}
