package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.SavedLoadToggleResponse;
import com.swiftload.loadservice.security.Actor;

import java.util.List;
import java.util.UUID;

public interface SavedLoadService {

    /**
     * Bookmarks the load, or removes the bookmark if it already exists.
     */
    SavedLoadToggleResponse toggle(UUID loadId, Actor actor);

    List<LoadResponse> listSaved(Actor actor);
}
