/*
 *  This file is part of geoplaces.
 *
 *  Geoplaces is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Geoplaces is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Geoplaces. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.geoplaces.config;

import com.dedicatedcode.geoplaces.service.StatsService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Times API requests and hands them to {@link StatsService}. Registered for {@code /api/v1/**} in {@link WebConfig}.
 */
@Component
public class StatsInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(StatsInterceptor.class);
    private static final String START_TIME_ATTRIBUTE = StatsInterceptor.class.getName() + ".startTime";

    private final StatsService statsService;

    public StatsInterceptor(StatsService statsService) {
        this.statsService = statsService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object startTime = request.getAttribute(START_TIME_ATTRIBUTE);
        if (startTime == null) {
            return;
        }

        try {
            long responseTime = System.currentTimeMillis() - (Long) startTime;

            Map<String, String> sortedParams = request.getParameterMap().entrySet().stream()
                    .collect(Collectors.toMap(
                            Map.Entry::getKey,
                            entry -> String.join(",", entry.getValue()),
                            (e1, e2) -> e1,
                            TreeMap::new
                    ));

            int resultCount = 0;
            String resultCountHeader = response.getHeader("X-Result-Count");
            if (resultCountHeader != null) {
                try {
                    resultCount = Integer.parseInt(resultCountHeader);
                } catch (NumberFormatException e) {
                    logger.debug("Invalid result count header: {}", resultCountHeader);
                }
            }

            statsService.recordQuery(
                    endpointOf(request),
                    sortedParams,
                    responseTime,
                    resultCount,
                    response.getStatus()
            );
        } catch (Exception e) {
            logger.debug("Failed to record stats for request", e);
        }
    }

    /**
     * The mapped route, e.g. {@code /api/v1/places/{id}}, so lookups of different ids count as one endpoint.
     */
    private static String endpointOf(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : request.getRequestURI();
    }
}
