/**
 * starmeta: STAR metadata toolkit.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of starmeta.
 *
 * starmeta is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.starmeta.config;

import java.io.File;
import java.net.URISyntaxException;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link ConfigurationManager} and {@link ConfigurationPostProcessor}.
 *
 * @author Bastian Gloeckle
 */
public class ConfigurationManagerTest {
  private AnnotationConfigApplicationContext ctx;

  @AfterMethod
  public void shutDown() {
    System.clearProperty(ConfigurationManager.CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    if (ctx != null)
      ctx.close();
    ctx = null;
  }

  @Test
  public void defaultValues() {
    // GIVEN
    ctx = StarmetaContext.create();

    // WHEN
    ConfigurationManager configManager = ctx.getBean(ConfigurationManager.class);

    // THEN
    Assert.assertEquals(configManager.getValue(ConfigKey.FLOAT_DECIMALS), "6");
    Assert.assertEquals(configManager.getValue(ConfigKey.MERGE_KEY_THRESHOLD), "0.5");
    Assert.assertEquals(configManager.getValue(ConfigKey.MERGE_DUPLICATE_KEY_POLICY), "FAIL");
  }

  @Test
  public void customValuesOverrideDefaults() throws URISyntaxException {
    // GIVEN
    File custom = new File(getClass().getResource("/starmeta-custom-test.properties").toURI());
    System.setProperty(ConfigurationManager.CUSTOM_PROPERTIES_SYSTEM_PROPERTY, custom.getAbsolutePath());

    // WHEN
    ctx = StarmetaContext.create();
    ConfigurationManager configManager = ctx.getBean(ConfigurationManager.class);

    // THEN
    Assert.assertEquals(configManager.getValue(ConfigKey.FLOAT_DECIMALS), "3", "Expected overridden value");
    Assert.assertEquals(configManager.getDefaultValue(ConfigKey.FLOAT_DECIMALS), "6");
    Assert.assertEquals(configManager.getValue(ConfigKey.IMAGE_INDEX_DIGITS), "6", "Expected default value");
  }

  @Test
  public void configValuesAreWired() {
    // GIVEN
    ctx = new AnnotationConfigApplicationContext();
    ctx.scan(StarmetaContext.BASE_PKG);
    ctx.register(ConfiguredBean.class);
    ctx.refresh();

    // WHEN
    ConfiguredBean bean = ctx.getBean(ConfiguredBean.class);

    // THEN
    Assert.assertEquals(bean.decimals, 6);
    Assert.assertEquals(bean.threshold, 0.5, 1e-12);
    Assert.assertEquals(bean.blockName, "images");
    Assert.assertEquals(bean.policy, TestPolicy.FAIL);
  }

  public static enum TestPolicy {
    FAIL, LAST_WINS
  }

  public static class ConfiguredBean {
    @Config(ConfigKey.FLOAT_DECIMALS)
    private int decimals;

    @Config(ConfigKey.MERGE_KEY_THRESHOLD)
    private double threshold;

    @Config(ConfigKey.DATA_BLOCK_NAME)
    private String blockName;

    @Config(ConfigKey.MERGE_DUPLICATE_KEY_POLICY)
    private TestPolicy policy;
  }
}
