package me.christianrobert.vbtranspiler.transpiler.syntax;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.syntax.DeclarationPatterns.Declaration;
import me.christianrobert.vbtranspiler.transpiler.syntax.DeclarationPatterns.DeclarationType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationPatternsTest {

    // ========== VB ==========

    @Test
    void classify_vbClass() {
        Declaration declaration = DeclarationPatterns.classify("Public Class Calculator", Language.VBNET);

        assertNotNull(declaration);
        assertEquals(DeclarationType.CLASS, declaration.getType());
        assertEquals("Calculator", declaration.getName());
    }

    @Test
    void classify_vbFunctionWithReturnType() {
        Declaration declaration = DeclarationPatterns.classify(
                "Public Function Add(a As Integer, b As Integer) As Integer", Language.VBNET);

        assertNotNull(declaration);
        assertEquals(DeclarationType.METHOD, declaration.getType());
        assertEquals("Add", declaration.getName());
        assertEquals("Integer", declaration.getTypeName());
    }

    @Test
    void classify_vbSubHasNoReturnType() {
        Declaration declaration = DeclarationPatterns.classify("Private Sub DoWork()", Language.VBNET);

        assertNotNull(declaration);
        assertEquals(DeclarationType.METHOD, declaration.getType());
        assertNull(declaration.getTypeName());
    }

    @Test
    void classify_vbConstructor() {
        Declaration declaration = DeclarationPatterns.classify("Public Sub New(seed As Integer)", Language.VBNET);

        assertNotNull(declaration);
        assertEquals(DeclarationType.CONSTRUCTOR, declaration.getType());
        assertEquals("New", declaration.getName());
    }

    @Test
    void classify_vbPropertyAndField() {
        Declaration property = DeclarationPatterns.classify("Public Property Name As String", Language.VBNET);
        Declaration field = DeclarationPatterns.classify("Private _count As Integer", Language.VBNET);

        assertEquals(DeclarationType.PROPERTY, property.getType());
        assertEquals("String", property.getTypeName());
        assertEquals(DeclarationType.FIELD, field.getType());
        assertEquals("_count", field.getName());
    }

    @Test
    void classify_vbLocalIsNotAField() {
        assertNull(DeclarationPatterns.classify("Dim x As Integer", Language.VBNET));
        assertNull(DeclarationPatterns.classify("Return a + b", Language.VBNET));
    }

    // ========== C# ==========

    @Test
    void classify_csharpMethod() {
        Declaration declaration = DeclarationPatterns.classify("public int Add(int a, int b) {", Language.CSHARP);

        assertNotNull(declaration);
        assertEquals(DeclarationType.METHOD, declaration.getType());
        assertEquals("Add", declaration.getName());
        assertEquals("int", declaration.getTypeName());
    }

    @Test
    void classify_csharpConstructor() {
        Declaration declaration = DeclarationPatterns.classify("public Calculator(int seed)", Language.CSHARP);

        assertNotNull(declaration);
        assertEquals(DeclarationType.CONSTRUCTOR, declaration.getType());
        assertEquals("Calculator", declaration.getName());
    }

    @Test
    void classify_csharpFieldAndProperty() {
        Declaration field = DeclarationPatterns.classify("private int _count;", Language.CSHARP);
        Declaration property = DeclarationPatterns.classify("public string Name { get; set; }", Language.CSHARP);

        assertEquals(DeclarationType.FIELD, field.getType());
        assertEquals("_count", field.getName());
        assertEquals(DeclarationType.PROPERTY, property.getType());
        assertEquals("Name", property.getName());
        assertEquals("string", property.getTypeName());
    }

    @Test
    void classify_csharpStatementsAreNotDeclarations() {
        assertNull(DeclarationPatterns.classify("return Compute(x);", Language.CSHARP));
        assertNull(DeclarationPatterns.classify("", Language.CSHARP));
        assertNull(DeclarationPatterns.classify(null, Language.CSHARP));
    }
}
