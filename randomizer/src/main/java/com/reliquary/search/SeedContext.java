package com.reliquary.search;

import com.google.common.primitives.Longs;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.reliquary.model.RandomizerOptions;
import com.reliquary.util.Randomization;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Everything that determines the random stream of an attempt, except the nonce.
 *
 * <p>The stream of nonce {@code n} is seeded from SHA-256 of the JSON object
 * {@code {"version", "options", "seed", "nonce"}}, so it depends only on these
 * values and never on which worker runs it.
 *
 * @param version release tag
 * @param options canonical JSON of the randomizer options
 * @param seed    user seed string
 */
public record SeedContext(String version, String options, String seed) {

    public static SeedContext of(String version, RandomizerOptions options, String seed) {
        return new SeedContext(version, options.toJson().toString(), seed);
    }

    /**
     * The salted seed string of one nonce.
     */
    public String salt(long nonce) {
        JsonObject json = new JsonObject();
        json.addProperty("version", version);
        json.add("options", JsonParser.parseString(options));
        json.addProperty("seed", seed);
        json.addProperty("nonce", nonce);
        return json.toString();
    }

    /**
     * A fresh random stream for one nonce.
     */
    public Randomization randomization(long nonce) {
        return new Randomization(seedOf(salt(nonce)));
    }

    static long seedOf(String salt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(salt.getBytes(StandardCharsets.UTF_8));
            return Longs.fromByteArray(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
