package com.scholary.flow.youtube;

/** A video id together with its human-readable title. */
public record VideoIdentity(String videoId, String title) {}
