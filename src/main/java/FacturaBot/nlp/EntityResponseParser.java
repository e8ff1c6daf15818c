package FacturaBot.nlp;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/*
Convierte la respuesta JSON del servicio de entidades.

Parses the entity service's JSON answer:

  {"ents": [{"label": "MONEY", "text": "1,180.00", "start": 120, "end": 128, "head": "total"}]}

"entities" is accepted as the array name as well.
*/
public final class EntityResponseParser {

    private EntityResponseParser() {
    }

    public static List<RecognizedEntity> parse(String json) {
        if (json == null || json.isBlank()) {
            throw new EntityRecognitionException("Empty entity response");
        }
        try {
            JSONObject obj = new JSONObject(json);
            JSONArray ents = obj.optJSONArray("ents");
            if (ents == null) {
                ents = obj.optJSONArray("entities");
            }
            if (ents == null) {
                throw new EntityRecognitionException("Entity response has no 'ents' array");
            }

            List<RecognizedEntity> entities = new ArrayList<>(ents.length());
            for (int i = 0; i < ents.length(); i++) {
                JSONObject ent = ents.getJSONObject(i);
                entities.add(new RecognizedEntity(
                        ent.optString("label", ""),
                        ent.optString("text", ""),
                        ent.optInt("start", -1),
                        ent.optString("head", "")));
            }
            return entities;
        } catch (JSONException e) {
            throw new EntityRecognitionException("Entity response parse error: " + e.getMessage(), e);
        }
    }
}
