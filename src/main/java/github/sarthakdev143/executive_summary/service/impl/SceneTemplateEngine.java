package github.sarthakdev143.executive_summary.service.impl;

import github.sarthakdev143.executive_summary.model.ResolvedScene;
import github.sarthakdev143.executive_summary.model.SceneTemplate;
import github.sarthakdev143.executive_summary.model.TokenStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Turns scene templates into concrete scene files by plain token substitution.
 *
 * <p>The scene format belongs to the renderer and is never parsed here. Each sub-scene of a scene file
 * starts with {@link #FRAME_MARKER}; counting the marker gives the number of renderable scenes.
 */
@Component
public class SceneTemplateEngine {

    private static final Logger logger = LoggerFactory.getLogger(SceneTemplateEngine.class);

    public static final String FRAME_MARKER = "SceneInfo Index=";

    public static final String T1_IMG = "T1_IMG";
    public static final String T2_IMG = "T2_IMG";
    public static final String RPIAL = "RPIAL";
    public static final String LPIAL = "LPIAL";
    public static final String RWHITE = "RWHITE";
    public static final String LWHITE = "LWHITE";

    public static final String TX_IMG = "TX_IMG";
    public static final String R_PIAL = "R_PIAL";
    public static final String L_PIAL = "L_PIAL";
    public static final String R_WHITE = "R_WHITE";
    public static final String L_WHITE = "L_WHITE";

    private static final List<String> PNGS_TOKENS = List.of(T1_IMG, T2_IMG, RPIAL, LPIAL, RWHITE, LWHITE);
    private static final List<String> BRAINSPRITE_TOKENS = List.of(TX_IMG, R_PIAL, L_PIAL, R_WHITE, L_WHITE);

    public SceneTemplate loadTemplate(Path templatePath, TokenStyle tokenStyle) throws IOException {
        String text;
        if (templatePath.getFileName().toString().endsWith(".gz")) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(templatePath))) {
                text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } else {
            text = Files.readString(templatePath, StandardCharsets.UTF_8);
        }
        return new SceneTemplate(templatePath, text, tokenStyle);
    }

    /**
     * Tokens of the anatomical-view template.
     */
    public Map<String, Path> pngsTokens(Path t2, Path t1, Path rightPial, Path leftPial, Path rightWhite, Path leftWhite) {
        Map<String, Path> tokens = new LinkedHashMap<>();
        tokens.put(T2_IMG, t2);
        tokens.put(T1_IMG, t1);
        tokens.put(RPIAL, rightPial);
        tokens.put(LPIAL, leftPial);
        tokens.put(RWHITE, rightWhite);
        tokens.put(LWHITE, leftWhite);
        return tokens;
    }

    /**
     * Tokens of the brainsprite template.
     */
    public Map<String, Path> brainspriteTokens(Path tx, Path rightPial, Path leftPial, Path rightWhite, Path leftWhite) {
        Map<String, Path> tokens = new LinkedHashMap<>();
        tokens.put(TX_IMG, tx);
        tokens.put(R_PIAL, rightPial);
        tokens.put(L_PIAL, leftPial);
        tokens.put(R_WHITE, rightWhite);
        tokens.put(L_WHITE, leftWhite);
        return tokens;
    }

    /**
     * Replaces every placeholder of every token. Path placeholders become absolute paths, since the
     * renderer resolves relative paths against the scene file's directory. The path placeholder is
     * replaced first because the name placeholder is a prefix of it in {@link TokenStyle#NAME_AND_PATH}
     * templates.
     */
    public String resolve(SceneTemplate template, Map<String, Path> tokens) {
        TokenStyle style = template.tokenStyle();
        String text = template.text();
        for (Map.Entry<String, Path> token : tokens.entrySet()) {
            Path path = token.getValue().toAbsolutePath().normalize();
            text = text.replace(style.pathPlaceholder(token.getKey()), path.toString());
            text = text.replace(style.namePlaceholder(token.getKey()), path.getFileName().toString());
        }
        return text;
    }

    /**
     * Resolves {@code template} and writes the result to {@code sceneFile}. The caller owns the file and
     * deletes it once the scenes are rendered.
     */
    public ResolvedScene writeScene(SceneTemplate template, Map<String, Path> tokens, Path sceneFile) throws IOException {
        String text = resolve(template, tokens);
        Files.writeString(sceneFile, text, StandardCharsets.UTF_8);
        List<String> unresolved = findUnresolvedPlaceholders(text, template.tokenStyle(), knownTokens(template.tokenStyle()));
        if (!unresolved.isEmpty()) {
            logger.warn("Scene {} from {} still contains placeholders {}", sceneFile, template.source(), unresolved);
        }
        return new ResolvedScene(sceneFile, text, unresolved);
    }

    /**
     * Number of sub-scenes in a resolved scene; zero when the marker does not occur at all.
     */
    public int countFrames(String sceneText) {
        int count = 0;
        int from = sceneText.indexOf(FRAME_MARKER);
        while (from >= 0) {
            count++;
            from = sceneText.indexOf(FRAME_MARKER, from + FRAME_MARKER.length());
        }
        return count;
    }

    /**
     * Token names the shipped templates of {@code style} use.
     */
    public List<String> knownTokens(TokenStyle style) {
        return style == TokenStyle.PATH_AND_NAME ? PNGS_TOKENS : BRAINSPRITE_TOKENS;
    }

    /**
     * Placeholders of the given tokens still present in {@code text}.
     */
    public List<String> findUnresolvedPlaceholders(String text, TokenStyle style, Iterable<String> tokenNames) {
        List<String> unresolved = new ArrayList<>();
        for (String token : tokenNames) {
            for (String placeholder : List.of(style.pathPlaceholder(token), style.namePlaceholder(token))) {
                if (text.contains(placeholder)) {
                    unresolved.add(placeholder);
                }
            }
        }
        return unresolved;
    }
}
