/*
 * Copyright 2016 LinkedIn Corp.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package com.linkedin.drelephant.failurematch.util;

import org.apache.hadoop.conf.Configuration;


/**
 * One named configuration value of failure matching , together with
 * the documentation of what it controls and whether the loaded configuration set it.
 * @param <T> : Type of the data
 */
public class FMConfiguration<T> {

  private final String configurationName;
  private final boolean overridden;
  private T value;
  private String doc;

  private FMConfiguration(String configurationName, boolean overridden) {
    this.configurationName = configurationName;
    this.overridden = overridden;
  }

  /**
   * @param configurationName : key of the value in FailureMatchConf.xml
   * @param configuration : loaded configuration , used only to know if the key is set
   */
  public static <T> FMConfiguration<T> named(String configurationName, Configuration configuration) {
    return new FMConfiguration<T>(configurationName, configuration.get(configurationName) != null);
  }

  public String getConfigurationName() {
    return configurationName;
  }

  /**
   * @return false when the value is the built in default
   */
  public boolean isOverridden() {
    return overridden;
  }

  public T getValue() {
    return value;
  }

  public FMConfiguration<T> setValue(T value) {
    this.value = value;
    return this;
  }

  public String getDoc() {
    return doc;
  }

  public FMConfiguration<T> setDoc(String doc) {
    this.doc = doc;
    return this;
  }

  @Override
  public String toString() {
    return "FMConfiguration{" + "configurationName='" + configurationName + '\'' + ", value=" + value
        + ", overridden=" + overridden + ", doc='" + doc + '\'' + '}';
  }
}
