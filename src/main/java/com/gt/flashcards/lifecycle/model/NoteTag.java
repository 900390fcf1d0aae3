package com.gt.flashcards.lifecycle.model;

public record NoteTag(String id, String name, String slug) { }
