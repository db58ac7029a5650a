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
package org.starmeta.context;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 * Creates the Spring context holding all starmeta components.
 *
 * @author Bastian Gloeckle
 */
public class StarmetaContext {
  public static final String BASE_PKG = "org.starmeta";

  /**
   * Create and refresh a new context which contains all {@link AutoInstatiate} classes on the classpath. The caller is
   * responsible for closing the context.
   */
  public static AnnotationConfigApplicationContext create() {
    AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
    ctx.scan(BASE_PKG);
    ctx.refresh();
    return ctx;
  }
}
