package org.javai.springai.pantry.delegation;

import java.util.concurrent.Future;

/**
 * The turn a dispatch belongs to. The router registers its futures here so that superseding
 * the turn cancels them, and appends an audit record per dispatch.
 */
public interface DispatchScope {

	DispatchScope NONE = new DispatchScope() {
		@Override
		public void track(Future<?> future) {
		}

		@Override
		public void record(DelegationRecord record) {
		}

		@Override
		public boolean isCancelled() {
			return false;
		}
	};

	void track(Future<?> future);

	void record(DelegationRecord record);

	boolean isCancelled();
}
