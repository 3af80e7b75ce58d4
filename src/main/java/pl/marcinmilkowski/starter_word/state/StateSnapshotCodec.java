package pl.marcinmilkowski.starter_word.state;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * JSON form of {@link BotState}.
 *
 * Expected JSON structure:
 * {
 *   "used": ["crwth", ...],
 *   "history": [
 *     { "date": "2026-10-19", "word": "crwth", "suggesterId": "1234" },
 *     ...
 *   ],
 *   "queue": [
 *     { "submitterId": "5678", "word": "fjord" },
 *     ...
 *   ]
 * }
 *
 * {@code suggesterId} is omitted for sampler picks. Missing top-level arrays
 * decode as empty. Snapshots written with snake_case keys
 * ({@code suggester_id}, {@code submitter_id}) are still read.
 */
final class StateSnapshotCodec {

    private static final String SUGGESTER_KEY = "suggesterId";
    private static final String SUBMITTER_KEY = "submitterId";

    private StateSnapshotCodec() {
    }

    static String encode(BotState state) {
        JSONObject root = new JSONObject();
        root.put("used", new JSONArray(state.used()));

        JSONArray history = new JSONArray();
        for (UsedEntry e : state.history()) {
            JSONObject obj = new JSONObject();
            obj.put("date", e.date().toString());
            obj.put("word", e.word());
            if (e.suggesterId() != null) obj.put(SUGGESTER_KEY, e.suggesterId());
            history.add(obj);
        }
        root.put("history", history);

        JSONArray queue = new JSONArray();
        for (QueuedSuggestion q : state.queue()) {
            JSONObject obj = new JSONObject();
            obj.put(SUBMITTER_KEY, q.submitterId());
            obj.put("word", q.word());
            queue.add(obj);
        }
        root.put("queue", queue);

        return JSON.toJSONString(root, JSONWriter.Feature.PrettyFormat);
    }

    /**
     * @throws IllegalArgumentException if the content is not a valid snapshot
     */
    static BotState decode(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (RuntimeException e) {
            // truncated input can surface as an index error rather than JSONException
            throw new IllegalArgumentException("Malformed JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty state snapshot");
        }

        BotState state = new BotState();
        try {
            JSONArray used = root.getJSONArray("used");
            if (used != null) {
                for (int i = 0; i < used.size(); i++) {
                    state.addUsed(requireText(used.getString(i), "used[" + i + "]"));
                }
            }

            JSONArray history = root.getJSONArray("history");
            if (history != null) {
                for (int i = 0; i < history.size(); i++) {
                    JSONObject obj = history.getJSONObject(i);
                    if (obj == null) {
                        throw new IllegalArgumentException("Invalid history entry at index " + i);
                    }
                    LocalDate date = LocalDate.parse(requireText(obj.getString("date"), "history[" + i + "].date"));
                    String word = requireText(obj.getString("word"), "history[" + i + "].word");
                    state.addHistory(new UsedEntry(date, word, either(obj, SUGGESTER_KEY, "suggester_id")));
                }
            }

            JSONArray queue = root.getJSONArray("queue");
            if (queue != null) {
                for (int i = 0; i < queue.size(); i++) {
                    JSONObject obj = queue.getJSONObject(i);
                    if (obj == null) {
                        throw new IllegalArgumentException("Invalid queue entry at index " + i);
                    }
                    state.enqueue(new QueuedSuggestion(
                        requireText(either(obj, SUBMITTER_KEY, "submitter_id"), "queue[" + i + "]." + SUBMITTER_KEY),
                        requireText(obj.getString("word"), "queue[" + i + "].word")));
                }
            }
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        return state;
    }

    private static String either(JSONObject obj, String key, String legacyKey) {
        String value = obj.getString(key);
        return value != null ? value : obj.getString(legacyKey);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' in state snapshot");
        }
        return value;
    }
}
