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

package com.linkedin.drelephant.failurematch.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.linkedin.drelephant.failurematch.Rule;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Builds a {@link PatternCatalog} from its versioned JSON definition . Any problem in the
 * definition (bad JSON , invalid regex , level out of range , missing tag , duplicate tag)
 * is reported as {@link CatalogDefinitionException}.
 */
public class PatternCatalogLoader {
  private static final Logger logger = Logger.getLogger(PatternCatalogLoader.class);
  private final ObjectMapper objectMapper = new ObjectMapper();

  /**
   * Loads the catalog configured by fm.catalog.resource . The value is looked up on the
   * classpath first and then as a file path.
   * @return catalog
   */
  public PatternCatalog load() {
    return load(CATALOG_RESOURCE.getValue());
  }

  public PatternCatalog load(String resourceOrPath) {
    long startTime = System.currentTimeMillis();
    InputStream inputStream = PatternCatalogLoader.class.getClassLoader().getResourceAsStream(resourceOrPath);
    try {
      if (inputStream == null) {
        Path path = Paths.get(resourceOrPath);
        if (!Files.isReadable(path)) {
          throw new CatalogDefinitionException("Pattern catalog " + resourceOrPath + " not found");
        }
        inputStream = Files.newInputStream(path);
      }
      PatternCatalog catalog = load(inputStream, resourceOrPath);
      long endTime = System.currentTimeMillis();
      logger.info(" Pattern catalog loaded from " + resourceOrPath + " in " + (endTime - startTime) * 1.0 / (1000.0)
          + "s");
      return catalog;
    } catch (IOException e) {
      throw new CatalogDefinitionException("Unable to read pattern catalog " + resourceOrPath, e);
    } finally {
      closeQuietly(inputStream);
    }
  }

  /**
   * @param inputStream : JSON definition , not closed by this method
   * @param sourceName : used in messages
   * @return catalog
   */
  public PatternCatalog load(InputStream inputStream, String sourceName) {
    CatalogDefinition definition;
    try {
      definition = objectMapper.readValue(inputStream, CatalogDefinition.class);
    } catch (IOException e) {
      throw new CatalogDefinitionException("Pattern catalog " + sourceName + " is not a valid definition", e);
    }
    return fromDefinition(definition, sourceName);
  }

  public PatternCatalog fromDefinition(CatalogDefinition definition, String sourceName) {
    if (definition == null || Strings.isNullOrEmpty(definition.getVersion())) {
      throw new CatalogDefinitionException("Pattern catalog " + sourceName + " has no version");
    }
    List<Rule> rules = new ArrayList<>();
    Set<String> tags = new HashSet<>();
    addRules(rules, definition.getIgnoreRules(), RuleKind.IGNORE, sourceName, tags);
    addRules(rules, definition.getErrorRules(), RuleKind.ERROR, sourceName, tags);
    addRules(rules, definition.getWarningRules(), RuleKind.WARNING, sourceName, tags);
    if (rules.isEmpty()) {
      throw new CatalogDefinitionException("Pattern catalog " + sourceName + " has no rules");
    }
    return new PatternCatalog(definition.getVersion(), rules);
  }

  private void addRules(List<Rule> rules, List<RuleDefinition> definitions, RuleKind kind, String sourceName,
      Set<String> tags) {
    if (definitions == null) {
      return;
    }
    for (RuleDefinition ruleDefinition : definitions) {
      Rule rule = toRule(ruleDefinition, kind, sourceName);
      // the same tag may be shared by several error rules (for e.g two segfault spellings) but
      // a tag used by an ignore rule must stay unique
      if (kind == RuleKind.IGNORE && !tags.add(rule.getTag())) {
        throw new CatalogDefinitionException(
            "Pattern catalog " + sourceName + " has duplicate ignore rule tag " + rule.getTag());
      }
      rules.add(rule);
    }
  }

  /**
   * Converts one definition into a rule . Used by the loader and when reviewed
   * learned patterns are promoted into a catalog.
   */
  public static Rule toRule(RuleDefinition definition, RuleKind kind, String sourceName) {
    if (definition == null || Strings.isNullOrEmpty(definition.getPattern())) {
      throw new CatalogDefinitionException("Rule without pattern in " + sourceName);
    }
    if (Strings.isNullOrEmpty(definition.getTag())) {
      throw new CatalogDefinitionException(
          "Rule with pattern " + definition.getPattern() + " has no tag in " + sourceName);
    }
    try {
      switch (kind) {
        case IGNORE:
          if (definition.getLevel() != null) {
            throw new CatalogDefinitionException("Ignore rule " + definition.getTag() + " cannot have a level");
          }
          if (definition.getUnless() != null) {
            return new ConditionalIgnoreRule(definition.getPattern(), definition.getUnless(),
                definition.isCaseInsensitive(), definition.getTag());
          }
          return new SimpleIgnoreRule(definition.getPattern(), definition.isCaseInsensitive(), definition.getTag());
        case ERROR:
        case WARNING:
          if (definition.getUnless() != null) {
            throw new CatalogDefinitionException(
                "Only ignore rules can have an exception condition , found one on " + definition.getTag());
          }
          if (definition.getLevel() == null) {
            throw new CatalogDefinitionException("Rule " + definition.getTag() + " has no level");
          }
          return new ErrorRule(RegexRule.compile(definition.getPattern(), definition.isCaseInsensitive()), kind,
              definition.getLevel(), definition.getTag());
        default:
          throw new CatalogDefinitionException("Unknown rule kind " + kind);
      }
    } catch (PatternSyntaxException e) {
      throw new CatalogDefinitionException(
          "Rule " + definition.getTag() + " in " + sourceName + " has an invalid regex " + definition.getPattern(), e);
    } catch (IllegalArgumentException e) {
      throw new CatalogDefinitionException("Rule " + definition.getTag() + " in " + sourceName + " is invalid : "
          + e.getMessage(), e);
    }
  }

  private static void closeQuietly(InputStream inputStream) {
    try {
      if (inputStream != null) {
        inputStream.close();
      }
    } catch (IOException e) {
      logger.error(" Exception while closing the catalog stream ", e);
    }
  }
}
