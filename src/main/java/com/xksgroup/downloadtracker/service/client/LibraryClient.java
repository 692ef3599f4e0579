package com.xksgroup.downloadtracker.service.client;

import com.xksgroup.downloadtracker.exception.LibraryLookupException;
import com.xksgroup.downloadtracker.model.library.LibraryCandidate;

import java.util.List;

public interface LibraryClient {

    /** Instance name, recorded as the source of a match. */
    String getName();

    List<LibraryCandidate> searchByTitle(String title, Integer year) throws LibraryLookupException;
}
