package github.sarthakdev143.executive_summary.service.impl;

import github.sarthakdev143.executive_summary.model.ResolvedScene;
import github.sarthakdev143.executive_summary.model.SceneTemplate;
import github.sarthakdev143.executive_summary.model.TokenStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class SceneTemplateEngineTest {

    private final SceneTemplateEngine engine = new SceneTemplateEngine();

    @TempDir
    Path tempDir;

    @Test
    void resolvesEveryPngsPlaceholder() throws Exception {
        Path templateFile = tempDir.resolve("image_template_temp.scene");
        Files.writeString(templateFile, """
                <Scene>T1_IMG_PATH T1_IMG_NAME</Scene>
                <Scene>T2_IMG_PATH T2_IMG_NAME</Scene>
                <Surface>RPIAL_PATH LPIAL_PATH RWHITE_PATH LWHITE_PATH</Surface>
                <Names>RPIAL_NAME LPIAL_NAME RWHITE_NAME LWHITE_NAME</Names>
                """);
        SceneTemplate template = engine.loadTemplate(templateFile, TokenStyle.PATH_AND_NAME);
        Map<String, Path> tokens = engine.pngsTokens(
                Path.of("/data/MNINonLinear/T2w_restore.nii.gz"),
                Path.of("/data/MNINonLinear/T1w_restore.nii.gz"),
                Path.of("/data/surf/1234.R.pial.32k_fs_LR.surf.gii"),
                Path.of("/data/surf/1234.L.pial.32k_fs_LR.surf.gii"),
                Path.of("/data/surf/1234.R.white.32k_fs_LR.surf.gii"),
                Path.of("/data/surf/1234.L.white.32k_fs_LR.surf.gii"));

        String resolved = engine.resolve(template, tokens);

        assertThat(resolved)
                .contains("/data/MNINonLinear/T1w_restore.nii.gz T1w_restore.nii.gz")
                .contains("/data/MNINonLinear/T2w_restore.nii.gz T2w_restore.nii.gz")
                .contains("1234.R.pial.32k_fs_LR.surf.gii 1234.L.pial.32k_fs_LR.surf.gii");
        assertThat(engine.findUnresolvedPlaceholders(resolved, TokenStyle.PATH_AND_NAME, tokens.keySet())).isEmpty();
    }

    @Test
    void nameAndPathPlaceholderIsReplacedBeforeName() throws Exception {
        Path templateFile = tempDir.resolve("brainsprite.scene");
        Files.writeString(templateFile, "<File>TX_IMG_NAME_and_PATH</File><Name>TX_IMG_NAME</Name>"
                + "R_PIAL_NAME_and_PATH L_PIAL_NAME R_WHITE_NAME L_WHITE_NAME_and_PATH");
        SceneTemplate template = engine.loadTemplate(templateFile, TokenStyle.NAME_AND_PATH);
        Map<String, Path> tokens = engine.brainspriteTokens(
                Path.of("/data/T1w_restore.nii.gz"),
                Path.of("/data/R.pial.surf.gii"),
                Path.of("/data/L.pial.surf.gii"),
                Path.of("/data/R.white.surf.gii"),
                Path.of("/data/L.white.surf.gii"));

        String resolved = engine.resolve(template, tokens);

        assertThat(resolved).isEqualTo("<File>/data/T1w_restore.nii.gz</File><Name>T1w_restore.nii.gz</Name>"
                + "/data/R.pial.surf.gii L.pial.surf.gii R.white.surf.gii /data/L.white.surf.gii");
    }

    @Test
    void relativeTokenPathsBecomeAbsolute() throws Exception {
        Path templateFile = tempDir.resolve("image_template_temp.scene");
        Files.writeString(templateFile, "<p>T1_IMG_PATH</p><n>T1_IMG_NAME</n>");
        SceneTemplate template = engine.loadTemplate(templateFile, TokenStyle.PATH_AND_NAME);
        Path relative = Path.of("files", "MNINonLinear", "..", "MNINonLinear", "T1w_restore.nii.gz");

        String resolved = engine.resolve(template, Map.of(SceneTemplateEngine.T1_IMG, relative));

        Path expected = Path.of("files", "MNINonLinear", "T1w_restore.nii.gz").toAbsolutePath();
        assertThat(resolved).isEqualTo("<p>" + expected + "</p><n>T1w_restore.nii.gz</n>");
    }

    @Test
    void writeSceneReportsPlaceholdersLeftByMissingTokens() throws Exception {
        Path templateFile = tempDir.resolve("brainsprite.scene");
        Files.writeString(templateFile, "TX_IMG_NAME_and_PATH R_PIAL_NAME_and_PATH L_WHITE_NAME");
        SceneTemplate template = engine.loadTemplate(templateFile, TokenStyle.NAME_AND_PATH);

        ResolvedScene scene = engine.writeScene(template,
                Map.of(SceneTemplateEngine.TX_IMG, Path.of("/data/T1w_restore.nii.gz")),
                tempDir.resolve("t1_bs_scene.scene"));

        assertThat(scene.unresolvedPlaceholders()).containsExactly("R_PIAL_NAME_and_PATH", "R_PIAL_NAME", "L_WHITE_NAME");
    }

    @Test
    void writeSceneReportsNothingWhenFullyResolved() throws Exception {
        Path templateFile = tempDir.resolve("brainsprite.scene");
        Files.writeString(templateFile, "TX_IMG_NAME_and_PATH R_PIAL_NAME");
        SceneTemplate template = engine.loadTemplate(templateFile, TokenStyle.NAME_AND_PATH);

        ResolvedScene scene = engine.writeScene(template,
                engine.brainspriteTokens(
                        Path.of("/data/T1w_restore.nii.gz"),
                        Path.of("/data/R.pial.surf.gii"),
                        Path.of("/data/L.pial.surf.gii"),
                        Path.of("/data/R.white.surf.gii"),
                        Path.of("/data/L.white.surf.gii")),
                tempDir.resolve("t1_bs_scene.scene"));

        assertThat(scene.unresolvedPlaceholders()).isEmpty();
    }

    @Test
    void readsGzipCompressedTemplates() throws Exception {
        Path templateFile = tempDir.resolve("template.scene.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(templateFile))) {
            out.write("<Scene>TX_IMG_NAME_and_PATH</Scene>".getBytes(StandardCharsets.UTF_8));
        }

        SceneTemplate template = engine.loadTemplate(templateFile, TokenStyle.NAME_AND_PATH);

        assertThat(template.text()).isEqualTo("<Scene>TX_IMG_NAME_and_PATH</Scene>");
        assertThat(template.source()).isEqualTo(templateFile);
    }

    @Test
    void writeSceneLeavesTemplateUntouched() throws Exception {
        Path templateFile = tempDir.resolve("template.scene");
        Files.writeString(templateFile, "TX_IMG_NAME_and_PATH");
        SceneTemplate template = engine.loadTemplate(templateFile, TokenStyle.NAME_AND_PATH);
        Path sceneFile = tempDir.resolve("t1_bs_scene.scene");

        ResolvedScene scene = engine.writeScene(template,
                Map.of(SceneTemplateEngine.TX_IMG, Path.of("/data/T1w_restore.nii.gz")), sceneFile);

        assertThat(scene.sceneFile()).isEqualTo(sceneFile);
        assertThat(Files.readString(sceneFile)).isEqualTo("/data/T1w_restore.nii.gz");
        assertThat(Files.readString(templateFile)).isEqualTo("TX_IMG_NAME_and_PATH");
    }

    @Test
    void countsFrameMarkers() {
        StringBuilder text = new StringBuilder("<SceneFile>");
        for (int index = 1; index <= 169; index++) {
            text.append("<SceneInfo Index=\"").append(index).append("\"/>");
        }
        text.append("</SceneFile>");

        assertThat(engine.countFrames(text.toString())).isEqualTo(169);
        assertThat(engine.countFrames("<SceneFile/>")).isZero();
    }

    @Test
    void reportsPlaceholdersLeftInText() {
        assertThat(engine.findUnresolvedPlaceholders(
                "/data/T1.nii.gz R_PIAL_NAME",
                TokenStyle.NAME_AND_PATH,
                List.of(SceneTemplateEngine.TX_IMG, SceneTemplateEngine.R_PIAL)))
                .containsExactly("R_PIAL_NAME");
    }
}
