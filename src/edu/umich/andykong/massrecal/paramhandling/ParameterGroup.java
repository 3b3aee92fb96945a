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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class ParameterGroup {
    private static final Logger log = LoggerFactory.getLogger(ParameterGroup.class);

    private final String name;
    private final Map<String, Parameter<?>> parameters;


    public ParameterGroup(String name) {
        this.name = name;
        this.parameters = new LinkedHashMap<>();
    }

    public String getName() {
        return name;
    }

    public void addParam(Parameter<?> parameter) {
        if (parameters.containsKey(parameter.getKey()))
            throw new IllegalArgumentException("Parameter already exists: " + parameter.getKey());
        parameters.put(parameter.getKey(), parameter);
    }


    public Parameter<?> getParam(String key) {
        Parameter<?> parameter = parameters.get(key);
        if (parameter == null)
            throw new IllegalArgumentException("Parameter not found: " + key);
        return parameter;
    }

    public boolean hasParam(String key) {
        return parameters.containsKey(key);
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue(String key) {
        return ((Parameter<T>) getParam(key)).getValue();
    }

    public void parseParamValue(String key, String value) {
        getParam(key).parseValue(value);
    }

    /**
     * Applies every known key of the map; unknown keys are left for the caller.
     */
    public void parseParamValues(Map<String, String> values) {
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (parameters.containsKey(e.getKey()))
                parseParamValue(e.getKey(), e.getValue());
        }
    }

    public Map<String, Parameter<?>> getParameters() {
        return parameters;
    }

    public void printParameters() {
        log.info("Group: {}", name);
        parameters.forEach((key, parameter) -> log.info("\t{} = {}", key, parameter.getValue()));
    }
}
