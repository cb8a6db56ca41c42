package net.vcc.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.vcc.api.parser.ParserException;
import net.vcc.graph.FunctionEntity;
import net.vcc.graph.ObjectEntity;
import net.vcc.graph.PackageEntity;
import net.vcc.lexer.Lexer;
import net.vcc.parser.Parser;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

public class OutputTest {

    private static final String ADD =
        "func f(int a, int b) -> int { return a+b; }";

    private static PackageEntity parse(String source)
            throws ParserException {
        return new Parser(new Lexer(source).run()).run();
    }

    @Test
    public void printsIndentedTree() throws ParserException {
        String expected =
            "Package:default\n" +
            "  Function:value\n" +
            "    Class:int\n" +
            "    Object:a\n" +
            "      Class:int\n" +
            "    Object:b\n" +
            "      Class:int\n" +
            "    ReturnStatement\n" +
            "      OperatorExpression:plus\n" +
            "        ObjectExpression\n" +
            "          Object:a\n" +
            "            Class:int\n" +
            "        ObjectExpression\n" +
            "          Object:b\n" +
            "            Class:int\n";
        assertEquals(expected, GraphPrinter.print(parse(ADD)));
    }

    @Test
    public void printsFunctionWithoutReturnValue() throws ParserException {
        assertEquals("Package:default\n  Function:none\n" +
                     "    ReturnStatement\n",
                     GraphPrinter.print(parse("func g() { return; }")));
    }

    @Test
    public void translatesToC() throws ParserException {
        assertEquals("int f(int a, int b) {\n  return (a+b);\n}\n",
                     CTranslator.translate(parse(ADD)));
    }

    @Test
    public void translatesNestedAdditionWithParentheses()
            throws ParserException {
        PackageEntity pkg = parse("func f(int a, int b, int c) -> int " +
                                  "{ return a+b+c; }");
        assertEquals("int f(int a, int b, int c) {\n" +
                     "  return ((a+b)+c);\n}\n",
                     CTranslator.translate(pkg));
    }

    @Test
    public void translatesVoidFunctions() throws ParserException {
        PackageEntity pkg = parse("func g() {}\nfunc h(int x) { return; }");
        assertEquals("void g() {\n}\nvoid h(int x) {\n  return;\n}\n",
                     CTranslator.translate(pkg));
    }

    @Test
    public void serializesReferencesAsIds() throws ParserException {
        PackageEntity pkg = parse(ADD);
        long intId = pkg.getClassEntity("int").getId();
        FunctionEntity f = pkg.getFunction("f");
        ObjectEntity a = f.getObject("a");

        JSONObject json = GraphSerializer.toJSON(pkg);
        assertEquals("Package", json.getString("kind"));
        assertEquals("default", json.getString("name"));
        assertEquals(pkg.getId(), json.getLong("id"));
        assertEquals(1, json.getJSONArray("classes").length());

        JSONObject func = json.getJSONArray("functions").getJSONObject(0);
        assertEquals("f", func.getString("name"));
        assertEquals("value", func.getString("returnType"));
        assertEquals(intId, func.getLong("returnClass"));
        JSONArray objects = func.getJSONArray("objects");
        assertEquals(2, objects.length());
        assertEquals(a.getId(), objects.getJSONObject(0).getLong("id"));
        assertEquals(intId, objects.getJSONObject(0).getLong("class"));

        JSONObject ret = func.getJSONArray("statements").getJSONObject(0);
        assertEquals("ReturnStatement", ret.getString("kind"));
        JSONObject sum = ret.getJSONObject("expression");
        assertEquals("plus", sum.getString("operator"));
        JSONObject first = sum.getJSONArray("operands").getJSONObject(0);
        assertEquals("ObjectExpression", first.getString("kind"));
        assertEquals(a.getId(), first.getLong("object"));
    }

    @Test
    public void serializesMissingReferencesAsNull() throws ParserException {
        JSONObject func = GraphSerializer.toJSON(
            parse("func g() { return; }").getFunction("g"));
        assertEquals("none", func.getString("returnType"));
        assertTrue(func.isNull("returnClass"));
        JSONObject ret = func.getJSONArray("statements").getJSONObject(0);
        assertTrue(ret.isNull("expression"));
    }

}
