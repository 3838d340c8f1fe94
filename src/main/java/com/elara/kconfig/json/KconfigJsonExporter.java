package com.elara.kconfig.json;

import com.elara.kconfig.Choice;
import com.elara.kconfig.Kconfig;
import com.elara.kconfig.Location;
import com.elara.kconfig.MenuNode;
import com.elara.kconfig.Symbol;
import com.elara.kconfig.Tristate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON snapshot of a configuration, for tooling that does not want to parse
 * .config files:
 *
 * {
 *   "mainmenu": "...",
 *   "symbols": [ { name, type, value, userValue, visibility, assignable,
 *                  choice, prompts, locations }, ... ],
 *   "choices": [ { name, type, mode, visibility, selection, symbols }, ... ]
 * }
 */
public final class KconfigJsonExporter {

    private final ObjectMapper om;

    public KconfigJsonExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public KconfigJsonExporter(ObjectMapper om) {
        this.om = om;
    }

    public ObjectNode export(Kconfig kconfig) {
        ObjectNode root = om.createObjectNode();
        root.put("mainmenu", kconfig.getMainmenuText());

        ArrayNode syms = root.putArray("symbols");
        for (Symbol sym : kconfig.getDefinedSymbols()) {
            syms.add(symbolNode(sym));
        }

        ArrayNode choices = root.putArray("choices");
        int index = 0;
        for (Choice choice : kconfig.getChoices()) {
            choices.add(choiceNode(choice, index++));
        }
        return root;
    }

    public String exportString(Kconfig kconfig) throws JsonProcessingException {
        return om.writeValueAsString(export(kconfig));
    }

    private ObjectNode symbolNode(Symbol sym) {
        ObjectNode n = om.createObjectNode();
        n.put("name", sym.getName());
        n.put("type", sym.getType().typeName());
        n.put("value", sym.getValue());
        if (sym.getUserValue() == null) n.putNull("userValue");
        else n.put("userValue", sym.getUserValue());
        n.put("visibility", sym.getVisibility().text());

        ArrayNode assignable = n.putArray("assignable");
        for (Tristate t : sym.getAssignable()) assignable.add(t.text());

        if (sym.getChoice() == null) n.putNull("choice");
        else n.put("choice", choiceLabel(sym.getChoice()));

        ArrayNode prompts = n.putArray("prompts");
        for (MenuNode node : sym.getNodes()) {
            if (node.getPrompt() != null) prompts.add(node.getPrompt().text());
        }

        ArrayNode locations = n.putArray("locations");
        for (Location loc : sym.getDefinitionLocations()) locations.add(loc.toString());
        return n;
    }

    private ObjectNode choiceNode(Choice choice, int index) {
        ObjectNode n = om.createObjectNode();
        if (choice.getName() == null) n.putNull("name");
        else n.put("name", choice.getName());
        n.put("index", index);
        n.put("type", choice.getType().typeName());
        n.put("mode", choice.getMode().text());
        n.put("visibility", choice.getVisibility().text());

        Symbol selection = choice.getSelection();
        if (selection == null) n.putNull("selection");
        else n.put("selection", selection.getName());

        ArrayNode members = n.putArray("symbols");
        for (Symbol sym : choice.getSymbols()) members.add(sym.getName());
        return n;
    }

    // Named choices by name, anonymous ones by their first member
    private static String choiceLabel(Choice choice) {
        if (choice.getName() != null) return choice.getName();
        return choice.getSymbols().isEmpty() ? "<choice>" : "<choice " + choice.getSymbols().get(0).getName() + ">";
    }
}
