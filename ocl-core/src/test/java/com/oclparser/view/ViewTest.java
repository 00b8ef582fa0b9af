package com.oclparser.view;

import com.oclparser.Parser;
import com.oclparser.ast.Attribute;
import com.oclparser.ast.Block;
import com.oclparser.ast.Document;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Navigates a realistic deployment process: four steps, floating attributes, duplicated
 * package blocks and duplicated property dictionaries.
 */
public class ViewTest {

    private static final String CLIENT_STEP = "back-up-store-client-filesystem";
    private static final String SERVER_STEP = "back-up-store-server-filesystem";
    private static final String UPGRADE_ACTION = "upgrade-store-client-software";

    private static String source;
    private static DocumentView root;

    @BeforeAll
    static void loadFixture() throws IOException {
        try (InputStream in = ViewTest.class.getResourceAsStream("/octopus-deployment.ocl")) {
            assertNotNull(in, "fixture missing");
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        root = Views.parse(source);
    }

    private static Object scalar(Object... path) {
        ViewValue value = root.at(path).orElseThrow(() -> new AssertionError("absent: " + List.of(path)));
        return assertInstanceOf(Scalar.class, value).value();
    }

    private static int sizeAt(Object... path) {
        return root.at(path).orElseThrow(() -> new AssertionError("absent: " + List.of(path))).size();
    }

    @Test
    void testRootExposesMembersByIndexAndName() {
        assertEquals(7, root.size());
        assertEquals(4, root.get("step").orElseThrow().size());
        assertInstanceOf(BlockCollection.class, root.get("step").orElseThrow());
        assertEquals(root.get(0), root.at("step", 0));
        assertTrue(root.get(7).isEmpty());
        assertTrue(root.get(-1).isEmpty());
        assertTrue(root.get("test").isEmpty());
    }

    @Test
    void testBlocksByIndex() {
        assertEquals(2, sizeAt("step", 0, "action"));
        assertEquals(2, sizeAt(0, "action"));
        assertEquals(1, sizeAt("step", 1, "action"));
        assertEquals(1, sizeAt(1, "action"));
    }

    @Test
    void testFloatingAttributes() {
        assertEquals(1, scalar("int_attribute"));
        assertEquals(1, sizeAt("array_attribute"));
        assertEquals(1, scalar("array_attribute", 0));
        assertEquals(1, scalar(4, "int_attribute"));

        AttributeView floating = assertInstanceOf(AttributeView.class, root.get(4).orElseThrow());
        assertEquals(List.of("int_attribute"), floating.keys());
        assertEquals(Map.of("int_attribute", 1), floating.toInterchangeTree());
    }

    @Test
    void testBlocksByLabel() {
        assertEquals(2, sizeAt("step", CLIENT_STEP, "action"));
        assertEquals(1, sizeAt("step", SERVER_STEP, "action"));
        assertTrue(root.at("step", "does-not-exist").isEmpty());
        assertEquals(root.getByLabel("step", CLIENT_STEP), root.at("step", CLIENT_STEP));
    }

    @Test
    void testNameAndLabels() {
        assertEquals(CLIENT_STEP, scalar("step", CLIENT_STEP, "__labels", 0));
        assertEquals(1, sizeAt("step", CLIENT_STEP, "__labels"));
        assertEquals("step", scalar("step", CLIENT_STEP, "__name"));
        assertEquals("action", scalar("step", CLIENT_STEP, "action", UPGRADE_ACTION, "__name"));

        BlockView step = assertInstanceOf(BlockView.class, root.at("step", CLIENT_STEP).orElseThrow());
        assertEquals(Optional.of("step"), step.name());
        assertEquals(List.of(CLIENT_STEP), step.labels());
    }

    @Test
    void testDuplicatedBlocksAndDictionaries() {
        assertEquals("", scalar("step", CLIENT_STEP, "action", UPGRADE_ACTION,
            "packages", "Pos.Client.Application", 0, "properties", 0, "Purpose"));
        assertEquals("", scalar("step", 0, "action", 1, "packages", 0, "properties", 0, "Purpose"));
        assertEquals("", scalar(0, "action", 1, "packages", "Pos.Client.Application", 0, "properties", 0, "Purpose"));
        assertTrue(root.at("step", CLIENT_STEP, "action", UPGRADE_ACTION, "packages", "does-not-exist").isEmpty());
        assertEquals("Second properties", scalar("step", CLIENT_STEP, "action", UPGRADE_ACTION,
            "packages", "Pos.Client.Application", 0, "properties", 1, "Purpose"));
        assertEquals("Second properties", scalar("step", 0, "action", 1, "packages", 0, "properties", 1, "Purpose"));
        assertEquals("Third properties", scalar("step", CLIENT_STEP, "action", UPGRADE_ACTION,
            "packages", "Pos.Client.Application", 1, "properties", 1, "Purpose"));
        assertEquals("Third properties", scalar("step", 0, "action", 1, "packages", 1, "properties", 1, "Purpose"));
        assertEquals("", scalar("step", CLIENT_STEP, "action", UPGRADE_ACTION,
            "packages", "Pos.Client.Application", 1, "properties", 0, "Purpose"));
    }

    @Test
    void testAttributeValues() {
        assertEquals("false", scalar("step", CLIENT_STEP, "action", UPGRADE_ACTION,
            "properties", "Octopus.Action.RunOnServer"));
        assertEquals("false", scalar("step", CLIENT_STEP, "action", 0, "properties", "Octopus.Action.RunOnServer"));
        assertEquals("Upgrade POS client software", scalar("step", CLIENT_STEP, "name"));
        assertEquals(10, scalar("step", CLIENT_STEP, "number_value"));
        assertEquals(false, scalar("step", CLIENT_STEP, "bool_value"));
        assertEquals("100", scalar("step", CLIENT_STEP, "properties", "Octopus.Action.MaxParallelism"));
        assertEquals("Octopus.Script", scalar("step", CLIENT_STEP, "action", CLIENT_STEP, "action_type"));
        assertEquals("Octopus.Script", scalar("step", CLIENT_STEP, "action", 1, "action_type"));
    }

    @Test
    void testArrayValues() {
        assertEquals(5, sizeAt("step", CLIENT_STEP, "array_value"));
        assertEquals(1, scalar("step", CLIENT_STEP, "array_value", 0));
        assertEquals(2, scalar("step", CLIENT_STEP, "array_value", 1));
        assertEquals(3, scalar("step", CLIENT_STEP, "array_value", 2));
        assertEquals("test", scalar("step", CLIENT_STEP, "array_value", 3));
        assertEquals(1, scalar("step", CLIENT_STEP, "array_value", 4, "test"));
        assertEquals("array_value", scalar("step", CLIENT_STEP, "array_value", 4, "__name"));
        assertTrue(root.at("step", CLIENT_STEP, "array_value", 5).isEmpty());
    }

    @Test
    void testIndentedHeredocValue() {
        Object script = scalar("step", CLIENT_STEP, "action", CLIENT_STEP,
            "properties", "Octopus.Action.Script.ScriptBody");

        assertEquals("Write-Highlight \"Backing up store client filesystem\"\n"
            + "\n"
            + "Start-Sleep 2\n"
            + "\n"
            + "Write-Highlight \"Finished backing up store client filesystem\"\n"
            + "\n", script);
    }

    @Test
    void testKeys() {
        ViewValue step = root.get(0).orElseThrow();
        assertEquals(List.of("name", "array_value", "number_value", "bool_value", "properties", "action",
            "__name", "__labels"), step.keys());
        assertEquals(8, step.size());

        ViewValue properties = step.get("properties").orElseThrow();
        assertEquals(List.of("Octopus.Action.MaxParallelism", "Octopus.Action.TargetRoles", "__name"),
            properties.keys());

        ViewValue packages = root.at("step", 0, "action", 1).orElseThrow();
        assertEquals(List.of("action_type", "name", "properties", "packages", "__name", "__labels"),
            packages.keys());

        assertEquals(List.of("0", "1", "2", "3"), root.get("step").orElseThrow().keys());
        assertEquals(List.of(), root.at("int_attribute").orElseThrow().keys());
        assertEquals(0, root.at("int_attribute").orElseThrow().size());
    }

    @Test
    void testFloatingDictionaryIsNamedAfterItsAttribute() {
        DictionaryView properties = assertInstanceOf(DictionaryView.class, root.get("properties").orElseThrow());

        assertEquals(Optional.of("properties"), properties.name());
        assertEquals(List.of("Extract", "Purpose", "SelectionMode", "__name"), properties.keys());
    }

    @Test
    void testInterchangeTree() {
        @SuppressWarnings("unchecked")
        List<Object> tree = (List<Object>) root.toInterchangeTree();
        assertEquals(7, tree.size());

        @SuppressWarnings("unchecked")
        Map<String, Object> step = (Map<String, Object>) tree.get(0);
        assertEquals("step", step.get("__name"));
        assertEquals(List.of(CLIENT_STEP), step.get("__labels"));
        assertEquals(List.of(1, 2, 3, "test", Map.of("test", 1, "__name", "array_value")), step.get("array_value"));
        assertEquals(Map.of("int_attribute", 1), tree.get(4));
    }

    @Test
    void testDeterminism() {
        assertEquals(root, Views.parse(source));
        assertEquals(root.hashCode(), Views.parse(source).hashCode());
        assertEquals(root.toInterchangeTree(), Views.parse(source).toInterchangeTree());
        assertNotEquals(Views.parse("int_attribute = 2"), Views.parse("int_attribute = 3"));
        assertNotEquals(Views.parse("int_attribute = 2").toInterchangeTree(),
            Views.parse("int_attribute = 3").toInterchangeTree());
    }

    @Test
    void testEqualityIgnoringOneKey() {
        String original = """
            step "back-up-store-server-filesystem" {
                name = "Back up store server filesystem"
                properties = {
                    Octopus.Action.TargetRoles = "pos-server"
                }

                action {
                    action_type = "Octopus.Script"
                    properties = {
                        Octopus.Action.RunOnServer = "false"
                        Octopus.Action.Script.ScriptBody = <<-EOT
                            Write-Highlight "Backing up store server filesystem"
                            Start-Sleep 5
                            EOT
                    }
                }
            }
            """;
        String edited = original.replace("Back up store server filesystem\"", "This has been edited\"");
        assertNotEquals(original, edited);

        ViewValue first = Views.parse(original).get(0).orElseThrow();
        ViewValue second = Views.parse(edited).get(0).orElseThrow();
        assertNotEquals(first, second);

        Map<String, Object> firstTree = new LinkedHashMap<>(((NodeView) first).toInterchangeTree());
        Map<String, Object> secondTree = new LinkedHashMap<>(((NodeView) second).toInterchangeTree());
        firstTree.remove("name");
        secondTree.remove("name");
        assertEquals(firstTree, secondTree);
    }

    @Test
    void testViewsAreReadOnly() {
        @SuppressWarnings("unchecked")
        List<Object> tree = (List<Object>) root.toInterchangeTree();
        assertThrows(UnsupportedOperationException.class, () -> tree.add("test"));

        NodeView step = (NodeView) root.get(0).orElseThrow();
        assertThrows(UnsupportedOperationException.class, () -> step.toInterchangeTree().put("test", "test"));
        assertThrows(UnsupportedOperationException.class, () -> step.keys().add("test"));
        assertTrue(root.get("test").isEmpty());
        assertEquals(Views.parse(source), root);
    }

    @Test
    void testViewOfNode() {
        Document document = Parser.parse(source);
        Block step = (Block) document.body().get(0);
        Attribute name = (Attribute) step.children().get(0);

        ViewValue nested = Views.of(document, name);
        assertEquals(List.of("name", "__name"), nested.keys());
        assertEquals(Optional.of(Scalar.of("name")), nested.get("__name"));
        assertEquals(Optional.of(Scalar.of("Upgrade POS client software")), nested.get("name"));

        assertEquals(Views.of(document).get(0).orElseThrow(), Views.of(document, step));
        assertInstanceOf(DocumentView.class, Views.of(document, document));

        Attribute arrayValue = (Attribute) step.children().get(1);
        assertInstanceOf(ValueList.class, Views.of(document, arrayValue.value()));

        Document other = Parser.parse(source);
        assertThrows(IllegalArgumentException.class, () -> Views.of(document, other.body().get(0)));
    }

    @Test
    void testViewsExposeTheirNodes() {
        Document document = root.document();
        assertEquals(7, document.size());

        BlockCollection steps = assertInstanceOf(BlockCollection.class, root.get("step").orElseThrow());
        assertEquals(4, steps.blocks().size());
        BlockView step = assertInstanceOf(BlockView.class, steps.get(0).orElseThrow());
        assertSame(steps.blocks().get(0), step.block());
        assertSame(step.block(), step.node());
        assertTrue(document.owns(step.node()));

        DictionaryView properties = assertInstanceOf(DictionaryView.class, root.get("properties").orElseThrow());
        assertSame(properties.dictionary(), properties.node());
        Attribute owner = assertInstanceOf(Attribute.class,
            document.parentOf(properties.dictionary()).orElseThrow());
        assertEquals("properties", owner.name());
        assertTrue(document.body().contains(owner));

        AttributeView floating = assertInstanceOf(AttributeView.class, root.get(4).orElseThrow());
        assertEquals("int_attribute", floating.attribute().name());
        assertSame(document.body().get(4), floating.node());
    }

    @Test
    void testIndexKeysResolveByPosition() {
        ViewValue steps = root.get("step").orElseThrow();
        ViewValue array = root.at("step", CLIENT_STEP, "array_value").orElseThrow();

        for (ViewValue view : List.of(root, steps, array)) {
            for (String key : view.keys()) {
                assertTrue(view.get(Integer.parseInt(key)).isPresent(), "index " + key + " of " + view);
            }
        }
        // Index keys are not names
        assertTrue(root.get("0").isEmpty());
        assertTrue(array.get("0").isEmpty());
    }

    @Test
    void testInterchangeTreeIsBuiltOnce() {
        DocumentView fresh = Views.parse(source);
        assertSame(fresh.toInterchangeTree(), fresh.toInterchangeTree());

        ViewValue steps = fresh.get("step").orElseThrow();
        assertSame(steps.toInterchangeTree(), steps.toInterchangeTree());

        NodeView step = (NodeView) steps.get(0).orElseThrow();
        Object tree = step.toInterchangeTree();
        assertEquals(step.hashCode(), step.hashCode());
        assertEquals(step, root.get(0).orElseThrow());
        assertSame(tree, step.toInterchangeTree());
    }

    @Test
    void testPathSegmentsMustBeNamesOrIndices() {
        assertThrows(IllegalArgumentException.class, () -> root.at("step", 1.5));
        assertEquals(Optional.of(root), root.at());
    }
}
