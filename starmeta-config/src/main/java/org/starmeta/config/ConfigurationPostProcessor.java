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

import java.lang.reflect.Field;
import java.util.Deque;
import java.util.LinkedList;

import javax.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.FatalBeanException;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.util.ReflectionUtils;
import org.starmeta.context.AutoInstatiate;

/**
 * A {@link BeanPostProcessor} that will fill the fields annotated with {@link Config} correctly.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ConfigurationPostProcessor implements BeanPostProcessor {

  private static final Logger logger = LoggerFactory.getLogger(ConfigurationPostProcessor.class);

  @Inject
  private ConfigurationManager configManager;

  @Override
  public Object postProcessBeforeInitialization(Object bean, String beanName) throws BeansException {

    Deque<Class<?>> classes = new LinkedList<>();
    classes.add(bean.getClass());
    while (!classes.isEmpty()) {
      Class<?> clazz = classes.poll();

      if (clazz == null || clazz.equals(Object.class))
        break;

      for (Field f : clazz.getDeclaredFields()) {
        Config[] c = f.getAnnotationsByType(Config.class);
        if (c.length > 0) {
          String configKey = c[0].value();
          String valueString = configManager.getValue(configKey);
          if (valueString == null)
            throw new FatalBeanException(bean.getClass().getName() + "." + f.getName()
                + " requires config value of which no value is available: " + configKey);

          Object value = convert(bean, f, valueString.trim());

          ReflectionUtils.makeAccessible(f);
          try {
            logger.debug("Wiring config value of '{}' to '{}.{}'", configKey, bean.getClass().getName(), f.getName());
            f.set(bean, value);
          } catch (IllegalArgumentException | IllegalAccessException e) {
            throw new FatalBeanException("Could not wire config value to " + f, e);
          }
        }
      }
      classes.add(clazz.getSuperclass());
    }

    return bean;
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private Object convert(Object bean, Field f, String valueString) {
    try {
      if (f.getType().equals(Long.class) || f.getType().equals(Long.TYPE))
        return Long.valueOf(valueString);
      else if (f.getType().equals(Double.class) || f.getType().equals(Double.TYPE))
        return Double.valueOf(valueString);
      else if (f.getType().equals(Integer.class) || f.getType().equals(Integer.TYPE))
        return Integer.valueOf(valueString);
      else if (f.getType().equals(Boolean.class) || f.getType().equals(Boolean.TYPE))
        return Boolean.valueOf(valueString);
      else if (f.getType().equals(String.class))
        return valueString;
      else if (f.getType().isEnum())
        return Enum.valueOf((Class<Enum>) f.getType(), valueString);
    } catch (IllegalArgumentException e) {
      throw new FatalBeanException("Invalid config value '" + valueString + "' for '" + bean.getClass().getName()
          + "." + f.getName() + "'.", e);
    }

    throw new FatalBeanException("Cannot wire config value for '" + bean.getClass().getName() + "." + f.getName()
        + " as the datatype is not supported.");
  }

  @Override
  public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
    return bean;
  }

}
