/// Provides APIs for parsing JSON text into an immutable tree of JSON values.
///
/// ## Parsing JSON documents
/// Parsing produces a `JsonObject` via `Json.parse(String)`, `Json.parse(Reader)`
/// or `Json.parse(CharProducer)`. The document root must be an object. A failed
/// parse throws `JsonParseException`, whose message starts with the line and
/// column at which the input stopped matching the grammar.
///
/// ## Retrieving JSON values
/// Every value reports its `JsonKind`. Navigation and conversion methods on
/// `JsonValue` throw `JsonAssertionException` when applied to the wrong kind:
/// ```java
/// var name = doc.get("foo").get("bar").element(0).string();
/// ```
///
/// ## Supplying characters
/// The parser reads through a `CharProducer`. `CharProducers` covers strings
/// and readers; other sources implement the interface directly.
package lyza.json;
