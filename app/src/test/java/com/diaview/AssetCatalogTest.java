package com.diaview;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AssetCatalogTest
{

	/** Single quotes stand in for double quotes to keep the literals readable. */
	private static AssetCatalog parse(String json) throws RenderException
	{
		return AssetCatalog.parse(json.replace('\'', '"').getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void keepsStringMappings() throws RenderException
	{
		AssetCatalog catalog = parse("{'image_map': {'0': '0.png', '1': 'sub/1.png'}, 'dependencies': {'1': '0'}}");

		assertEquals(Optional.of("0.png"), catalog.filenameOf("0"));
		assertEquals(Optional.of("sub/1.png"), catalog.filenameOf("1"));
		assertEquals(Optional.of("0"), catalog.parentOf("1"));
		assertEquals(Optional.empty(), catalog.parentOf("0"));
		assertEquals(Optional.empty(), catalog.filenameOf("2"));
		assertEquals(2, catalog.size());
	}

	@Test
	void skipsNonStringValues() throws RenderException
	{
		AssetCatalog catalog = parse("{'image_map': {'a': 'a.png', 'b': 7, 'c': null, 'd': ['d.png'], 'e': {'f': 'x'}, 'g': true},"
				+ " 'dependencies': {'a': 1, 'h': 'a'}}");

		assertEquals(List.of("a"), catalog.ids());
		assertEquals(Optional.empty(), catalog.filenameOf("b"));
		assertEquals(Optional.empty(), catalog.filenameOf("c"));
		assertEquals(Optional.empty(), catalog.parentOf("a"));
		assertEquals(Optional.of("a"), catalog.parentOf("h"));
	}

	@Test
	void ignoresUnknownMembersAndMissingSections() throws RenderException
	{
		AssetCatalog catalog = parse("{'root_images': ['0'], 'image_map': {'0': '0.png'}}");

		assertEquals(List.of("0"), catalog.ids());
		assertEquals(Optional.empty(), catalog.parentOf("0"));

		AssetCatalog empty = parse("{}");
		assertEquals(0, empty.size());
	}

	@Test
	void nonObjectSectionIsSkipped() throws RenderException
	{
		AssetCatalog catalog = parse("{'image_map': ['0.png'], 'dependencies': 'nope'}");

		assertEquals(0, catalog.size());
		assertEquals(Optional.empty(), catalog.parentOf("0"));
	}

	@Test
	void danglingReferencesAreAcceptedAtLoad() throws RenderException
	{
		AssetCatalog catalog = parse("{'image_map': {'a': 'a.png'}, 'dependencies': {'a': 'ghost'}}");

		assertEquals(Optional.of("ghost"), catalog.parentOf("a"));
		assertEquals(Optional.empty(), catalog.filenameOf("ghost"));
	}

	@Test
	void malformedJsonFails()
	{
		RenderException ex = assertThrows(RenderException.class, () -> parse("{'image_map': "));
		assertEquals(RenderException.Reason.MALFORMED_MANIFEST, ex.reason());
		assertNotNull(ex.getCause());
	}

	@Test
	void nonObjectRootFails()
	{
		assertEquals(RenderException.Reason.MALFORMED_MANIFEST,
				assertThrows(RenderException.class, () -> parse("[1, 2]")).reason());
		assertEquals(RenderException.Reason.MALFORMED_MANIFEST,
				assertThrows(RenderException.class, () -> parse("")).reason());
	}

	@Test
	void idsAreInNaturalOrder()
	{
		AssetCatalog catalog = new AssetCatalog(
				Map.of("10", "10.png", "2", "2.png", "1", "1.png", "b", "b.png", "a2", "x", "a10", "y", "002", "z"),
				Map.of());

		assertEquals(List.of("1", "002", "2", "10", "a2", "a10", "b"), catalog.ids());
	}

	@Test
	void naturalOrderHandlesHugeNumbers()
	{
		List<String> ids = new ArrayList<>(List.of("99999999999999999999999", "5"));
		ids.sort(AssetCatalog.NATURAL_ORDER);

		assertEquals(List.of("5", "99999999999999999999999"), ids);
	}

	@Test
	void catalogIsACopy()
	{
		Map<String, String> images = new HashMap<>(Map.of("a", "a.png"));
		AssetCatalog catalog = new AssetCatalog(images, Map.of());
		images.put("b", "b.png");

		assertEquals(Optional.empty(), catalog.filenameOf("b"));
		assertEquals(Optional.empty(), catalog.filenameOf(null));
	}

	@Test
	void loadsManifestFromArchive(@TempDir Path tempDir) throws IOException
	{
		Path zip = ArchiveFixtures.archive()
				.manifest("{\"image_map\": {\"0\": \"0.png\"}, \"dependencies\": {}}")
				.writeTo(tempDir.resolve("set.dia"));

		AssetCatalog catalog = AssetCatalog.load(zip);
		assertEquals(Optional.of("0.png"), catalog.filenameOf("0"));
	}

	@Test
	void archiveWithoutManifestFails(@TempDir Path tempDir) throws IOException
	{
		Path zip = ArchiveFixtures.archive().entry("0.png", new byte[]{1}).writeTo(tempDir.resolve("set.dia"));

		RenderException ex = assertThrows(RenderException.class, () -> AssetCatalog.load(zip));
		assertEquals(RenderException.Reason.NOT_FOUND, ex.reason());
		assertEquals(AssetCatalog.MANIFEST_ENTRY, ex.subject());
	}
}
