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

public class BooleanParameter implements Parameter<Boolean> {
    private final String key;
    private boolean value;
    private final boolean defaultValue;
    private final String description;

    public BooleanParameter(String key, boolean value, String description) {
        this.key = key;
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
    public Boolean getValue() {
        return value;
    }

    @Override
    public Boolean getDefaultValue() {
        return defaultValue;
    }

    @Override
    public void setValue(Boolean value) throws IllegalArgumentException {
        if (!isValid(value))
            throw new IllegalArgumentException(key + " received a null argument");
        this.value = value;
    }

    // accepts true/false and 1/0 like the rest of the parameter file
    @Override
    public void parseValue(String value) throws IllegalArgumentException {
        String v = value.trim().toLowerCase();
        if (v.equals("true") || v.equals("1"))
            setValue(true);
        else if (v.equals("false") || v.equals("0"))
            setValue(false);
        else
            throw new IllegalArgumentException(key + " expects true/false, got [" + value + "]");
    }

    @Override
    public boolean isValid(Boolean value) {
        return value != null;
    }
}
