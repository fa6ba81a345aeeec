package com.loom.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Component
public class ApiLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(ApiLoggingFilter.class);

    // async 응답(event log 조회)은 dispatch가 끝날 때 한 번만 남긴다
    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        long t0 = System.currentTimeMillis();
        try {
            chain.doFilter(req, res);
        } finally {
            if (!isAsyncStarted(req)) {
                long ms = System.currentTimeMillis() - t0;
                log.info("[API] {} {} -> {} ({}ms)",
                        req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            }
        }
    }
}
