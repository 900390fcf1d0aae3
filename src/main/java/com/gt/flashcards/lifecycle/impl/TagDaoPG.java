package com.gt.flashcards.lifecycle.impl;

import com.gt.flashcards.lifecycle.TagDao;
import com.gt.flashcards.lifecycle.model.NoteTag;
import com.gt.flashcards.model.ReservedLabel;
import com.gt.flashcards.util.IdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class TagDaoPG implements TagDao {

    private static final Logger log = LoggerFactory.getLogger(TagDaoPG.class);

    // The no-op update makes the conflicting row visible to RETURNING
    private static final String ENSURE_RESERVED_LABEL_SQL =
            "INSERT INTO tags (id, user_id, name, slug, color, description) " +
            "VALUES (:tagId, :owner, :name, :slug, :color, :description) " +
            "ON CONFLICT (user_id, slug) DO UPDATE SET slug = EXCLUDED.slug " +
            "RETURNING id";

    private static final String ATTACH_TAG_SQL =
            "INSERT INTO note_tags (note_id, tag_id) VALUES (:noteId, :tagId) " +
            "ON CONFLICT DO NOTHING";

    private static final String DETACH_TAG_SQL =
            "DELETE FROM note_tags WHERE note_id = :noteId AND tag_id = :tagId";

    private static final String LOAD_TAGS_FOR_NOTE_SQL =
            "SELECT t.id, t.name, t.slug " +
            "FROM note_tags nt JOIN tags t ON nt.tag_id = t.id " +
            "WHERE nt.note_id = :noteId " +
            "ORDER BY t.name";

    private static final String LOAD_TAG_OWNER_SQL =
            "SELECT user_id FROM tags WHERE id = :tagId";

    private final NamedParameterJdbcTemplate template;

    public TagDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public String ensureReservedLabel(String owner, ReservedLabel reservedLabel) {
        String tagId = template.queryForObject(ENSURE_RESERVED_LABEL_SQL, Map.of(
                "tagId", IdUtil.toUuid(IdUtil.newId()),
                "owner", IdUtil.toUuid(owner),
                "name", reservedLabel.getDisplayName(),
                "slug", reservedLabel.getSlug(),
                "color", reservedLabel.getColor(),
                "description", reservedLabel.getDescription()), String.class);

        log.debug("Reserved label {} for user {} resolved to tag {}", reservedLabel.getSlug(), owner, tagId);

        return tagId;
    }

    @Override
    public boolean attachTag(String noteId, String tagId) {
        return template.update(ATTACH_TAG_SQL, Map.of("noteId", IdUtil.toUuid(noteId), "tagId", IdUtil.toUuid(tagId))) > 0;
    }

    @Override
    public boolean detachTag(String noteId, String tagId) {
        return template.update(DETACH_TAG_SQL, Map.of("noteId", IdUtil.toUuid(noteId), "tagId", IdUtil.toUuid(tagId))) > 0;
    }

    @Override
    public List<NoteTag> loadTagsForNote(String noteId) {
        return template.query(LOAD_TAGS_FOR_NOTE_SQL, Map.of("noteId", IdUtil.toUuid(noteId)),
                (rs, rowNum) -> new NoteTag(rs.getString("id"), rs.getString("name"), rs.getString("slug")));
    }

    @Override
    public Optional<String> loadTagOwner(String tagId) {
        List<String> owners = template.queryForList(LOAD_TAG_OWNER_SQL, Map.of("tagId", IdUtil.toUuid(tagId)), String.class);

        return owners.isEmpty() ? Optional.empty() : Optional.of(owners.get(0));
    }
}
