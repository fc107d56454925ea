package org.javai.springai.pantry.inventory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.InventoryDeltaException;
import org.javai.springai.pantry.model.PantryItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PantryLedger")
class PantryLedgerTest {

	private static final LocalDate EXPIRY = LocalDate.of(2026, 10, 25);

	private final List<PantryItem> pantry = List.of(
			new PantryItem("egg", 6),
			new PantryItem("flour", 1, "kg", EXPIRY));

	@Nested
	@DisplayName("accepted changes")
	class Accepted {

		@Test
		void addsNewItemAtTheEnd() {
			List<PantryItem> result = PantryLedger.apply(pantry, List.of(new InventoryDelta("Tomatoes", 3)));

			assertThat(result).extracting(PantryItem::name).containsExactly("egg", "flour", "tomato");
			assertThat(result.get(2).quantity()).isEqualTo(3.0);
		}

		@Test
		void keepsExistingUnitAndExpiry() {
			List<PantryItem> result = PantryLedger.apply(pantry, List.of(new InventoryDelta("flour", 0.5)));

			PantryItem flour = result.get(1);
			assertThat(flour.quantity()).isEqualTo(1.5);
			assertThat(flour.unit()).isEqualTo("kg");
			assertThat(flour.expirationDate()).isEqualTo(EXPIRY);
		}

		@Test
		void removesItemThatReachesZero() {
			List<PantryItem> result = PantryLedger.apply(pantry, List.of(new InventoryDelta("eggs", -6)));

			assertThat(result).extracting(PantryItem::name).containsExactly("flour");
		}

		@Test
		void appliesDeltasInOrder() {
			List<PantryItem> result = PantryLedger.apply(pantry,
					List.of(new InventoryDelta("milk", 1), new InventoryDelta("milk", -1), new InventoryDelta("egg", -2)));

			assertThat(result).extracting(PantryItem::name).containsExactly("egg", "flour");
			assertThat(result.get(0).quantity()).isEqualTo(4.0);
		}
	}

	@Nested
	@DisplayName("rejected changes")
	class Rejected {

		@Test
		void cannotRemoveMissingItem() {
			assertThatThrownBy(() -> PantryLedger.apply(pantry, List.of(new InventoryDelta("butter", -3))))
					.isInstanceOf(InventoryDeltaException.class)
					.hasMessage("Cannot remove 3 butter: none in the pantry");
		}

		@Test
		void cannotGoBelowZero() {
			assertThatThrownBy(() -> PantryLedger.apply(pantry, List.of(new InventoryDelta("egg", -7))))
					.isInstanceOf(InventoryDeltaException.class)
					.hasMessage("Cannot remove 7 egg: only 6 in the pantry")
					.extracting(e -> ((InventoryDeltaException) e).ingredient())
					.isEqualTo("egg");
		}

		@Test
		void rejectsUnitMismatch() {
			assertThatThrownBy(() -> PantryLedger.apply(pantry, List.of(new InventoryDelta("flour", -200, "g"))))
					.isInstanceOf(InventoryDeltaException.class)
					.hasMessage("Unit mismatch for flour: pantry uses kg, change uses g");
		}

		@Test
		void leavesInputUntouchedWhenALaterDeltaFails() {
			List<PantryItem> original = new ArrayList<>(pantry);

			assertThatThrownBy(() -> PantryLedger.apply(original,
					List.of(new InventoryDelta("egg", -2), new InventoryDelta("butter", -1))))
					.isInstanceOf(InventoryDeltaException.class);

			assertThat(original).containsExactlyElementsOf(pantry);
		}
	}
}
