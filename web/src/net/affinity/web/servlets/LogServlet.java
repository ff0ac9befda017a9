/*
 * Copyright Affinity Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package net.affinity.web.servlets;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Collection;
import java.util.List;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import com.google.common.collect.Lists;

import net.affinity.common.log.MemoryHandler;
import net.affinity.web.InitListener;

/**
 * <p>Responds to a GET request to {@code /log.txt(?lines=n)} with the most recent log lines kept by
 * {@link MemoryHandler}, oldest first. {@code lines} limits output to the last n lines.</p>
 */
public final class LogServlet extends HttpServlet {

  @Override
  protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
    int maxLines;
    try {
      maxLines = getMaxLines(request);
    } catch (IllegalArgumentException iae) {
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, iae.toString());
      return;
    }

    MemoryHandler logHandler = (MemoryHandler) getServletContext().getAttribute(InitListener.LOG_HANDLER);
    Collection<String> lines = logHandler.getLogLines();
    List<String> snapshot;
    synchronized (lines) {
      snapshot = Lists.newArrayList(lines);
    }

    response.setContentType("text/plain");
    response.setCharacterEncoding("UTF-8");
    PrintWriter out = response.getWriter();
    for (String line : snapshot.subList(Math.max(0, snapshot.size() - maxLines), snapshot.size())) {
      out.write(line); // Already has newline
    }
  }

  private static int getMaxLines(HttpServletRequest request) {
    String linesString = request.getParameter("lines");
    if (linesString == null) {
      return Integer.MAX_VALUE;
    }
    int lines = Integer.parseInt(linesString);
    if (lines <= 0) {
      throw new IllegalArgumentException("lines must be positive: " + lines);
    }
    return lines;
  }

}
