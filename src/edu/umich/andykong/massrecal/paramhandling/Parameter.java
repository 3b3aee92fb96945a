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

public interface Parameter<T> {
    String getKey();
    String getDescription();
    T getValue();
    T getDefaultValue();
    void setValue(T value) throws IllegalArgumentException;
    void parseValue(String value) throws IllegalArgumentException;
    boolean isValid(T value);
}
