package com.gt.flashcards.suspension.impl;

import com.gt.flashcards.model.SuspensionSource;
import com.gt.flashcards.suspension.SuspensionDao;
import com.gt.flashcards.suspension.model.PausedCard;
import com.gt.flashcards.util.IdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.*;

public class SuspensionDaoPG implements SuspensionDao {

    private static final Logger log = LoggerFactory.getLogger(SuspensionDaoPG.class);

    private static final String SUSPEND_COLUMNS =
            "suspended = true, suspended_at = NOW(), suspended_by = :suspendedBy ";

    private static final String CLEAR_SUSPENSION_COLUMNS =
            "suspended = false, suspended_at = NULL, suspended_by = NULL, suspended_scope_id = NULL, resume_date = NULL, " +
            "pause_reason = NULL ";

    private static final String SUSPEND_CARD_SQL =
            "UPDATE cards " +
            "SET " + SUSPEND_COLUMNS + ", suspended_scope_id = NULL, resume_date = :resumeDate, pause_reason = :pauseReason " +
            "WHERE id = :cardId";

    private static final String SUSPEND_ACTIVE_CARD_SQL =
            "UPDATE cards " +
            "SET " + SUSPEND_COLUMNS + ", suspended_scope_id = NULL, resume_date = NULL, pause_reason = :pauseReason " +
            "WHERE id = :cardId AND suspended = false";

    private static final String RESUME_CARD_SQL =
            "UPDATE cards SET " + CLEAR_SUSPENSION_COLUMNS + "WHERE id = :cardId";

    private static final String CLEAR_SUSPENSION_BY_SOURCE_SQL =
            "UPDATE cards SET " + CLEAR_SUSPENSION_COLUMNS +
            "WHERE id = :cardId AND suspended = true AND suspended_by = :suspendedBy";

    private static final String TAG_SUBTREE_CTE =
            "WITH RECURSIVE tag_subtree AS ( " +
            "    SELECT id FROM tags WHERE id = :tagId " +
            "    UNION ALL " +
            "    SELECT t.id FROM tags t JOIN tag_subtree ts ON t.parent_id = ts.id " +
            "), ";

    private static final String SINGLE_TAG_CTE =
            "WITH tag_subtree AS ( " +
            "    SELECT id FROM tags WHERE id = :tagId " +
            "), ";

    private static final String TAGGED_ACTIVE_CARDS_CTE =
            "target_cards AS ( " +
            "    SELECT DISTINCT c.id FROM cards c " +
            "    JOIN note_tags nt ON c.note_id = nt.note_id " +
            "    JOIN tag_subtree ts ON nt.tag_id = ts.id " +
            "    WHERE c.suspended = false " +
            ") ";

    // Batch resume only lifts pauses made by a batch on the same tag or deck; manual, timed and leech pauses stay
    private static final String TAGGED_SUSPENDED_CARDS_CTE =
            "target_cards AS ( " +
            "    SELECT DISTINCT c.id FROM cards c " +
            "    JOIN note_tags nt ON c.note_id = nt.note_id " +
            "    JOIN tag_subtree ts ON nt.tag_id = ts.id " +
            "    WHERE c.suspended = true AND c.suspended_by = :suspendedBy AND c.suspended_scope_id = :tagId " +
            ") ";

    private static final String SUSPEND_TARGET_CARDS_SQL =
            "UPDATE cards " +
            "SET " + SUSPEND_COLUMNS + ", suspended_scope_id = :tagId, pause_reason = :pauseReason " +
            "FROM target_cards WHERE cards.id = target_cards.id " +
            "RETURNING cards.id";

    private static final String RESUME_TARGET_CARDS_SQL =
            "UPDATE cards " +
            "SET " + CLEAR_SUSPENSION_COLUMNS +
            "FROM target_cards WHERE cards.id = target_cards.id " +
            "RETURNING cards.id";

    private static final String DECK_SUBTREE_CTE =
            "WITH RECURSIVE deck_subtree AS ( " +
            "    SELECT id FROM decks WHERE id = :deckId " +
            "    UNION ALL " +
            "    SELECT d.id FROM decks d JOIN deck_subtree ds ON d.parent_id = ds.id " +
            ") ";

    private static final String SINGLE_DECK_CTE =
            "WITH deck_subtree AS ( " +
            "    SELECT id FROM decks WHERE id = :deckId " +
            ") ";

    private static final String SUSPEND_DECK_CARDS_SQL =
            "UPDATE cards " +
            "SET " + SUSPEND_COLUMNS + ", suspended_scope_id = :deckId, pause_reason = :pauseReason " +
            "WHERE deck_id IN (SELECT id FROM deck_subtree) AND suspended = false " +
            "RETURNING id";

    private static final String RESUME_DECK_CARDS_SQL =
            "UPDATE cards " +
            "SET " + CLEAR_SUSPENSION_COLUMNS +
            "WHERE deck_id IN (SELECT id FROM deck_subtree) AND suspended = true AND suspended_by = :suspendedBy " +
            "  AND suspended_scope_id = :deckId " +
            "RETURNING id";

    private static final String RESUME_EXPIRED_FOR_USER_SQL =
            "UPDATE cards " +
            "SET " + CLEAR_SUSPENSION_COLUMNS +
            "WHERE id IN ( " +
            "    SELECT c.id FROM cards c JOIN decks d ON c.deck_id = d.id " +
            "    WHERE d.user_id = :owner AND c.suspended = true AND c.resume_date IS NOT NULL AND c.resume_date <= :today " +
            ")";

    private static final String RESUME_ALL_EXPIRED_SQL =
            "UPDATE cards " +
            "SET " + CLEAR_SUSPENSION_COLUMNS +
            "WHERE suspended = true AND resume_date IS NOT NULL AND resume_date <= :today";

    private static final String LOAD_PAUSED_CARDS_SQL =
            "SELECT c.id, c.note_id, d.name AS deck_name, LEFT(n.sort_field_value, :previewLength) AS front_preview, " +
            "       c.suspended_at, c.suspended_by, c.resume_date, c.pause_reason " +
            "FROM cards c " +
            "JOIN decks d ON c.deck_id = d.id " +
            "JOIN notes n ON c.note_id = n.id " +
            "WHERE d.user_id = :owner AND c.suspended = true " +
            "ORDER BY c.suspended_at DESC";

    private static final String COUNT_PAUSED_CARDS_SQL =
            "SELECT COUNT(c.id) " +
            "FROM cards c JOIN decks d ON c.deck_id = d.id " +
            "WHERE d.user_id = :owner AND c.suspended = true";

    private static final String LOAD_TAG_NAMES_FOR_CARDS_SQL =
            "SELECT c.id AS card_id, t.name AS tag_name " +
            "FROM cards c " +
            "JOIN note_tags nt ON c.note_id = nt.note_id " +
            "JOIN tags t ON nt.tag_id = t.id " +
            "WHERE c.id IN (:cardIds) AND t.user_id = :owner " +
            "ORDER BY t.name";

    private final NamedParameterJdbcTemplate template;

    public SuspensionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public int suspendCard(String cardId, SuspensionSource suspendedBy, LocalDate resumeDate, String pauseReason) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("cardId", IdUtil.toUuid(cardId));
        params.addValue("suspendedBy", suspendedBy.getDbValue());
        params.addValue("resumeDate", resumeDate == null ? null : Date.valueOf(resumeDate));
        params.addValue("pauseReason", pauseReason);

        return template.update(SUSPEND_CARD_SQL, params);
    }

    @Override
    public int suspendActiveCard(String cardId, SuspensionSource suspendedBy, String pauseReason) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("cardId", IdUtil.toUuid(cardId));
        params.addValue("suspendedBy", suspendedBy.getDbValue());
        params.addValue("pauseReason", pauseReason);

        return template.update(SUSPEND_ACTIVE_CARD_SQL, params);
    }

    @Override
    public int resumeCard(String cardId) {
        return template.update(RESUME_CARD_SQL, Map.of("cardId", IdUtil.toUuid(cardId)));
    }

    @Override
    public int clearSuspension(String cardId, SuspensionSource suspendedBy) {
        return template.update(CLEAR_SUSPENSION_BY_SOURCE_SQL, Map.of(
                "cardId", IdUtil.toUuid(cardId),
                "suspendedBy", suspendedBy.getDbValue()));
    }

    @Override
    public List<String> suspendCardsByTag(String tagId, boolean includeChildren, String pauseReason) {
        String sql = (includeChildren ? TAG_SUBTREE_CTE : SINGLE_TAG_CTE) + TAGGED_ACTIVE_CARDS_CTE + SUSPEND_TARGET_CARDS_SQL;

        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("tagId", IdUtil.toUuid(tagId));
        params.addValue("suspendedBy", SuspensionSource.TagBatch.getDbValue());
        params.addValue("pauseReason", pauseReason);

        return template.queryForList(sql, params, String.class);
    }

    @Override
    public List<String> resumeCardsByTag(String tagId, boolean includeChildren) {
        String sql = (includeChildren ? TAG_SUBTREE_CTE : SINGLE_TAG_CTE) + TAGGED_SUSPENDED_CARDS_CTE + RESUME_TARGET_CARDS_SQL;

        return template.queryForList(sql, Map.of(
                "tagId", IdUtil.toUuid(tagId),
                "suspendedBy", SuspensionSource.TagBatch.getDbValue()), String.class);
    }

    @Override
    public List<String> suspendCardsByDeck(String deckId, boolean includeSubdecks, String pauseReason) {
        String sql = (includeSubdecks ? DECK_SUBTREE_CTE : SINGLE_DECK_CTE) + SUSPEND_DECK_CARDS_SQL;

        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("deckId", IdUtil.toUuid(deckId));
        params.addValue("suspendedBy", SuspensionSource.DeckBatch.getDbValue());
        params.addValue("pauseReason", pauseReason);

        return template.queryForList(sql, params, String.class);
    }

    @Override
    public List<String> resumeCardsByDeck(String deckId, boolean includeSubdecks) {
        String sql = (includeSubdecks ? DECK_SUBTREE_CTE : SINGLE_DECK_CTE) + RESUME_DECK_CARDS_SQL;

        return template.queryForList(sql, Map.of(
                "deckId", IdUtil.toUuid(deckId),
                "suspendedBy", SuspensionSource.DeckBatch.getDbValue()), String.class);
    }

    @Override
    public int resumeExpiredForUser(String owner, LocalDate today) {
        return template.update(RESUME_EXPIRED_FOR_USER_SQL, Map.of(
                "owner", IdUtil.toUuid(owner),
                "today", Date.valueOf(today)));
    }

    @Override
    public int resumeAllExpired(LocalDate today) {
        return template.update(RESUME_ALL_EXPIRED_SQL, Map.of("today", Date.valueOf(today)));
    }

    @Override
    public List<PausedCard> loadPausedCards(String owner, int previewLength) {
        return template.query(LOAD_PAUSED_CARDS_SQL,
                Map.of("owner", IdUtil.toUuid(owner), "previewLength", previewLength),
                SuspensionDaoPG::getPausedCardFromResultSet);
    }

    @Override
    public int countPausedCards(String owner) {
        Integer count = template.queryForObject(COUNT_PAUSED_CARDS_SQL, Map.of("owner", IdUtil.toUuid(owner)), Integer.class);

        return count == null ? 0 : count;
    }

    @Override
    public Map<String, List<String>> loadTagNamesForCards(String owner, Collection<String> cardIds) {
        if (cardIds.isEmpty()) {
            return Map.of();
        }

        Map<String, List<String>> tagNamesByCard = new HashMap<>();
        template.query(LOAD_TAG_NAMES_FOR_CARDS_SQL, Map.of("owner", IdUtil.toUuid(owner), "cardIds", IdUtil.toUuids(cardIds)), rs -> {
            tagNamesByCard.computeIfAbsent(rs.getString("card_id"), cardId -> new ArrayList<>()).add(rs.getString("tag_name"));
        });

        log.debug("Loaded tags for {} of {} paused cards", tagNamesByCard.size(), cardIds.size());

        return tagNamesByCard;
    }

    private static PausedCard getPausedCardFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        Timestamp suspendedAt = rs.getTimestamp("suspended_at");
        Date resumeDate = rs.getDate("resume_date");

        return new PausedCard(
                rs.getString("id"),
                rs.getString("note_id"),
                rs.getString("deck_name"),
                rs.getString("front_preview"),
                suspendedAt == null ? null : suspendedAt.toInstant(),
                SuspensionSource.fromDbValue(rs.getString("suspended_by")),
                resumeDate == null ? null : resumeDate.toLocalDate(),
                rs.getString("pause_reason"));
    }
}
