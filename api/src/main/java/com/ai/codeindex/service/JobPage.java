package com.ai.codeindex.service;

import com.ai.codeindex.entity.IndexJob;

import java.util.List;

/**
 * One page of jobs, newest first.
 */
public record JobPage(List<IndexJob> jobs, int page, int size, long totalCount) {
}
