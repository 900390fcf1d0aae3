package com.gt.flashcards.lifecycle.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.flashcards.exception.MappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gt.flashcards.lifecycle.NoteDao;
import com.gt.flashcards.lifecycle.model.NoteTypeSummary;
import com.gt.flashcards.model.Note;
import com.gt.flashcards.util.IdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class NoteDaoPG implements NoteDao {

    private static final Logger log = LoggerFactory.getLogger(NoteDaoPG.class);

    private static final TypeReference<LinkedHashMap<String, String>> FIELD_MAP_TYPE = new TypeReference<>() { };

    private static final String LOAD_NOTE_SQL =
            "SELECT id, user_id, note_type_id, fields, created_at, updated_at " +
            "FROM notes " +
            "WHERE id = :noteId";

    private static final String LOAD_NOTE_FOR_UPDATE_SQL = LOAD_NOTE_SQL + " FOR UPDATE";

    private static final String COPY_NOTE_SQL =
            "INSERT INTO notes (id, user_id, note_type_id, fields, sort_field_value, first_field_checksum) " +
            "SELECT :newNoteId, user_id, note_type_id, fields, sort_field_value, first_field_checksum " +
            "FROM notes " +
            "WHERE id = :sourceNoteId";

    private static final String COPY_NOTE_TAGS_SQL =
            "INSERT INTO note_tags (note_id, tag_id) " +
            "SELECT :newNoteId, tag_id FROM note_tags WHERE note_id = :sourceNoteId " +
            "ON CONFLICT DO NOTHING";

    private static final String MERGE_FIELDS_SQL =
            "UPDATE notes " +
            "SET fields = fields || CAST(:fieldUpdates AS jsonb), updated_at = NOW() " +
            "WHERE id = :noteId " +
            "RETURNING fields";

    private static final String UPDATE_SORT_FIELD_SQL =
            "UPDATE notes " +
            "SET sort_field_value = :sortFieldValue, first_field_checksum = :firstFieldChecksum " +
            "WHERE id = :noteId";

    private static final String TOUCH_CARDS_FOR_NOTE_SQL =
            "UPDATE cards SET updated_at = NOW() WHERE note_id = :noteId";

    private static final String LOAD_NOTE_TYPE_SUMMARY_SQL =
            "SELECT id, name, card_templates FROM note_types WHERE id = :noteTypeId";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public NoteDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Note> loadNote(String noteId) {
        return querySingleNote(LOAD_NOTE_SQL, noteId);
    }

    @Override
    public Optional<Note> loadNoteForUpdate(String noteId) {
        return querySingleNote(LOAD_NOTE_FOR_UPDATE_SQL, noteId);
    }

    private Optional<Note> querySingleNote(String sql, String noteId) {
        List<Note> notes = template.query(sql, Map.of("noteId", IdUtil.toUuid(noteId)), this::getNoteFromResultSet);

        return notes.isEmpty() ? Optional.empty() : Optional.of(notes.get(0));
    }

    @Override
    public int copyNote(String sourceNoteId, String newNoteId) {
        return template.update(COPY_NOTE_SQL, Map.of(
                "sourceNoteId", IdUtil.toUuid(sourceNoteId),
                "newNoteId", IdUtil.toUuid(newNoteId)));
    }

    @Override
    public int copyNoteTags(String sourceNoteId, String newNoteId) {
        return template.update(COPY_NOTE_TAGS_SQL, Map.of(
                "sourceNoteId", IdUtil.toUuid(sourceNoteId),
                "newNoteId", IdUtil.toUuid(newNoteId)));
    }

    @Override
    public Optional<Map<String, String>> mergeFields(String noteId, Map<String, String> fieldUpdates) {
        List<Map<String, String>> mergedFields = template.query(MERGE_FIELDS_SQL,
                Map.of("noteId", IdUtil.toUuid(noteId), "fieldUpdates", toJson(fieldUpdates)),
                (rs, rowNum) -> parseFields(rs.getString("fields")));

        return mergedFields.isEmpty() ? Optional.empty() : Optional.of(mergedFields.get(0));
    }

    @Override
    public void updateSortField(String noteId, String sortFieldValue, int firstFieldChecksum) {
        template.update(UPDATE_SORT_FIELD_SQL, Map.of(
                "noteId", IdUtil.toUuid(noteId),
                "sortFieldValue", sortFieldValue,
                "firstFieldChecksum", firstFieldChecksum));
    }

    @Override
    public int touchCardsForNote(String noteId) {
        return template.update(TOUCH_CARDS_FOR_NOTE_SQL, Map.of("noteId", IdUtil.toUuid(noteId)));
    }

    @Override
    public Optional<NoteTypeSummary> loadNoteTypeSummary(String noteTypeId) {
        List<NoteTypeSummary> noteTypes = template.query(LOAD_NOTE_TYPE_SUMMARY_SQL, Map.of("noteTypeId", IdUtil.toUuid(noteTypeId)),
                (rs, rowNum) -> new NoteTypeSummary(rs.getString("id"), rs.getString("name"), parseTemplateNames(rs.getString("card_templates"))));

        return noteTypes.isEmpty() ? Optional.empty() : Optional.of(noteTypes.get(0));
    }

    private Note getNoteFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Note(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("note_type_id"),
                parseFields(rs.getString("fields")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private Map<String, String> parseFields(String fieldsJson) {
        if (fieldsJson == null || fieldsJson.isBlank()) {
            return new LinkedHashMap<>();
        }

        try {
            return objectMapper.readValue(fieldsJson, FIELD_MAP_TYPE);
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to parse note fields";

            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }
    }

    // card_templates is an array of {name, front_html, back_html}; only the names are needed here
    private List<String> parseTemplateNames(String cardTemplatesJson) {
        List<String> templateNames = new ArrayList<>();
        if (cardTemplatesJson == null || cardTemplatesJson.isBlank()) {
            return templateNames;
        }

        try {
            for (JsonNode cardTemplate : objectMapper.readTree(cardTemplatesJson)) {
                JsonNode name = cardTemplate.get("name");
                templateNames.add(name == null || name.isNull() ? null : name.asText());
            }
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to parse card templates";

            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }

        return templateNames;
    }

    private String toJson(Map<String, String> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to serialize note fields";

            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
