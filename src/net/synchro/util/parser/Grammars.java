package net.synchro.util.parser;

import java.util.Set;
import net.synchro.api.parser.ContextFreeGrammar;
import net.synchro.api.parser.LexicalRule;
import net.synchro.api.parser.Production;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON descriptions of grammars, for inspection and debugging.
 * Symbols are rendered using their toString() method.
 */
public final class Grammars {

    private Grammars() {}

    public static JSONObject describe(Production<?> prod) {
        JSONArray symbols = new JSONArray();
        for (Object s : prod.getSymbols()) symbols.put(String.valueOf(s));
        JSONObject ret = new JSONObject();
        ret.put("head", String.valueOf(prod.getHead()));
        ret.put("symbols", symbols);
        return ret;
    }

    public static <S> JSONObject describe(ContextFreeGrammar<S> grammar) {
        JSONArray start = new JSONArray();
        for (S s : grammar.getStartSymbols()) start.put(String.valueOf(s));
        JSONArray productions = new JSONArray();
        for (Production<S> p : grammar.getProductions())
            productions.put(describe(p));
        JSONArray lexical = new JSONArray();
        for (LexicalRule<S> r : grammar.getLexicalRules())
            lexical.put(String.valueOf(r.getSymbol()));
        JSONObject ret = new JSONObject();
        ret.put("start", start);
        ret.put("productions", productions);
        ret.put("lexical", lexical);
        return ret;
    }

    public static <S> JSONObject describe(ContextFreeGrammar<S> grammar,
                                          Set<String> tokens) {
        JSONObject ret = describe(grammar);
        JSONArray tokenList = new JSONArray();
        for (String t : tokens) tokenList.put(t);
        ret.put("tokens", tokenList);
        return ret;
    }

}
