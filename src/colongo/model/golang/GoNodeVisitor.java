package colongo.model.golang;

import colongo.model.golang.type.GoFunctionParameter;
import colongo.model.golang.type.GoInterfaceTypeField;
import colongo.model.golang.type.GoStructTypeField;

public abstract class GoNodeVisitor<T, E extends Throwable> {

	public abstract T visit(GoModule module) throws E;
	public abstract T visit(GoComment comment) throws E;
	public abstract T visit(GoStatement statement) throws E;
	public abstract T visit(GoDeclaration declaration) throws E;
	public abstract T visit(GoExpression expression) throws E;
	public abstract T visit(GoSwitchCase switchCase) throws E;
	public abstract T visit(GoSelectCase selectCase) throws E;
	public abstract T visit(GoValueSpec valueSpec) throws E;
	public abstract T visit(GoTypeSpec typeSpec) throws E;
	public abstract T visit(GoImportSpec importSpec) throws E;
	public abstract T visit(GoFunctionParameter functionParameter) throws E;
	public abstract T visit(GoStructTypeField structTypeField) throws E;
	public abstract T visit(GoInterfaceTypeField interfaceTypeField) throws E;
}
