package com.company.watchdog.plugin;

import com.company.watchdog.domain.FetchedRow;
import com.company.watchdog.domain.QueryDetails;

import java.util.List;

/**
 * Runs a checker's query against its external source.
 * Only the first two columns of each row matter: the unique id and the epoch-seconds timestamp.
 */
public interface RowFetcher {

    List<FetchedRow> fetch(QueryDetails queryDetails);
}
